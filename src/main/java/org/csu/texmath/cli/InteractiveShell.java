package org.csu.texmath.cli;

import org.csu.texmath.cli.tool.ErrorHighlighter;
import org.csu.texmath.cli.tool.ExpressionFileConverter;
import org.csu.texmath.engine.ConversionResult;
import org.csu.texmath.engine.ExpressionProcessor;
import org.csu.texmath.engine.MathConverter;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Scanner;

/**
 * @author hidyouth
 * @description: 命令行交互界面
 *
 * 用法:
 * <pre>
 *   InteractiveShell                 交互模式
 *   InteractiveShell -e "a^2+b^2"    转换一个表达式后退出
 *   InteractiveShell formulas.txt    转换文件中的每一行后退出
 * </pre>
 * 交互模式下输入 {@code source <file>} 转换文件，输入 {@code exit} 退出。
 */
public class InteractiveShell {

    private static final String PROMPT = "texmath> ";

    private final MathConverter converter = new MathConverter();

    public static void main(String[] args) {
        InteractiveShell shell = new InteractiveShell();
        if (args.length >= 2 && args[0].equals("-e")) {
            boolean ok = shell.convertOne(args[1]);
            System.exit(ok ? 0 : 1);
        }
        if (args.length == 1) {
            boolean ok = shell.convertFile(Paths.get(args[0]));
            System.exit(ok ? 0 : 1);
        }
        shell.run();
    }

    private void run() {
        System.out.println("TeX math converter. Type 'exit' to quit, 'source <file>' to convert a file.");
        try (Scanner consoleScanner = new Scanner(System.in)) {
            while (true) {
                System.out.print(PROMPT);
                if (!consoleScanner.hasNextLine()) {
                    break;
                }
                String line = consoleScanner.nextLine();
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (trimmed.equalsIgnoreCase("exit")) {
                    break;
                }
                if (trimmed.toLowerCase().startsWith("source ")) {
                    convertFile(Paths.get(trimmed.substring("source".length()).trim()));
                    continue;
                }
                convertOne(line);
            }
        }
        System.out.println("Bye!");
    }

    boolean convertOne(String expression) {
        ExpressionProcessor processor = new ExpressionProcessor(converter,
                () -> expression,
                System.out::println,
                (message, span) -> {
                    System.err.println(message);
                    System.err.println(ErrorHighlighter.highlight(expression, span));
                });
        return processor.process().isSuccess();
    }

    boolean convertFile(Path file) {
        System.out.println("Converting expressions from: " + file);
        List<ExpressionFileConverter.Entry> entries;
        try {
            entries = new ExpressionFileConverter(converter).convertFile(file);
        } catch (IOException e) {
            System.err.println("Error reading file: " + e.getMessage());
            return false;
        }
        int failures = 0;
        for (ExpressionFileConverter.Entry entry : entries) {
            ConversionResult result = entry.result();
            if (result.isSuccess()) {
                System.out.println(entry.lineNumber() + ": " + result.markup());
            } else {
                failures++;
                System.err.println(entry.lineNumber() + ": " + result.message());
                System.err.println(ErrorHighlighter.highlight(entry.expression(), result.span()));
            }
        }
        System.out.println("Finished: " + (entries.size() - failures) + " converted, " + failures + " failed.");
        return failures == 0;
    }
}
