package org.csu.texmath.cli.tool;

import org.csu.texmath.engine.ConversionResult;
import org.csu.texmath.engine.MathConverter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 批量转换一个文本文件中的表达式
 *
 * 文件每行一个表达式；空行和以 '#' 开头的注释行会被跳过。
 */
public class ExpressionFileConverter {

    private final MathConverter converter;

    public ExpressionFileConverter(MathConverter converter) {
        this.converter = converter;
    }

    public List<Entry> convertFile(Path file) throws IOException {
        List<Entry> entries = new ArrayList<>();
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        for (int i = 0; i < lines.size(); i++) {
            String expression = lines.get(i).trim();
            if (expression.isEmpty() || expression.startsWith("#")) {
                continue;
            }
            entries.add(new Entry(i + 1, expression, converter.convert(expression)));
        }
        return entries;
    }

    /**
     * @param lineNumber 表达式在文件中的行号，从 1 开始
     * @param expression 去掉首尾空白后的表达式
     * @param result     转换结果
     */
    public record Entry(int lineNumber, String expression, ConversionResult result) {
    }
}
