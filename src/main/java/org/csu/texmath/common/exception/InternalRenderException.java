package org.csu.texmath.common.exception;

import org.csu.texmath.compiler.lexer.Token;

/**
 * 渲染器遇到没有渲染规则的节点类型时抛出，属于程序缺陷而不是输入错误。
 */
public class InternalRenderException extends ExpressionException {
    public InternalRenderException(Token token, String nodeType) {
        super(ErrorKind.INTERNAL, token, "Internal Error: no rendering rule for " + nodeType);
    }
}
