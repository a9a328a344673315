package org.csu.texmath.engine;

import org.csu.texmath.common.exception.ExpressionException;
import org.csu.texmath.common.exception.FormatException;
import org.csu.texmath.common.exception.InternalRenderException;
import org.csu.texmath.common.exception.ParseException;
import org.csu.texmath.compiler.lexer.Lexer;
import org.csu.texmath.compiler.parser.Parser;
import org.csu.texmath.compiler.parser.ast.ExpressionNode;
import org.csu.texmath.compiler.renderer.LatexRenderer;

/**
 * @author hidyouth
 * @description: 表达式到 TeX 标记的转换入口
 *
 * 串联 词法分析 -> 语法分析 -> 渲染 三个阶段。任一阶段出错都会立即终止，
 * 不会返回部分 AST 或部分标记。本类没有可变状态，可以被多个线程共享。
 */
public class MathConverter {

    private final LatexRenderer renderer = new LatexRenderer();

    /**
     * 词法分析并解析整个字符串。成功时保证所有 Token 都已被消耗。
     * null 按空字符串处理，得到“输入结尾”处的语法错误。
     * @throws ParseException 语法错误
     */
    public ExpressionNode parse(String sourceText) {
        String text = sourceText == null ? "" : sourceText;
        return new Parser(new Lexer(text).tokenize()).parse();
    }

    /**
     * 渲染一棵由 {@link #parse(String)} 生成的 AST。
     * @throws FormatException         表达式无法排版
     * @throws InternalRenderException 渲染器缺少某种节点的规则
     */
    public String render(ExpressionNode ast) {
        return renderer.render(ast);
    }

    /**
     * parse + render，把失败转成 {@link ConversionResult} 而不是抛出异常。
     */
    public ConversionResult convert(String sourceText) {
        try {
            return ConversionResult.success(render(parse(sourceText)));
        } catch (ExpressionException e) {
            return ConversionResult.failure(e);
        }
    }
}
