package org.csu.texmath.compiler.parser.ast;

import org.csu.texmath.compiler.lexer.Token;

import java.util.List;

/**
 * AST 节点: 表示一个标识符，如变量名 x 或希腊字母名 theta。
 */
public record IdentifierNode(Token token) implements ExpressionNode {

    public String getName() {
        return token.text();
    }

    @Override
    public int precedence() {
        return Precedence.ATOM;
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return "IdentifierNode[" + getName() + "]";
    }
}
