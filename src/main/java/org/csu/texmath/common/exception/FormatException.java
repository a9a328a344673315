package org.csu.texmath.common.exception;

import org.csu.texmath.compiler.lexer.Token;

/**
 * @author hidyouth
 * @description: 渲染阶段的自定义异常
 *
 * 语法正确但无法排版的表达式，例如未知函数名或非法标识符。总是指向出错节点的 Token。
 */
public class FormatException extends ExpressionException {
    public FormatException(Token token, String message) {
        super(ErrorKind.FORMAT, token,
                String.format("Format Error at offset %d: %s", token.offset(), message));
    }
}
