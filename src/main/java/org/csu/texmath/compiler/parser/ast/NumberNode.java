package org.csu.texmath.compiler.parser.ast;

import org.csu.texmath.compiler.lexer.Token;

import java.util.List;

/**
 * AST 节点: 表示一个数字字面量，保留原始文本 (e.g., 3.14, 1.23e-4)
 */
public record NumberNode(Token token) implements ExpressionNode {

    public String getLiteral() {
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
        return "NumberNode[" + getLiteral() + "]";
    }
}
