package org.csu.texmath.compiler.parser.ast;

import org.csu.texmath.compiler.lexer.Token;

import java.util.List;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., a + b, x ^ 2)
 */
public record BinaryExpressionNode(
        BinaryOperator operator,
        Token token,
        ExpressionNode left,
        ExpressionNode right
) implements ExpressionNode {

    @Override
    public int precedence() {
        return operator.precedence();
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return operator + "(" + left + ", " + right + ")";
    }
}
