package org.csu.texmath.compiler.parser.ast;

import org.csu.texmath.compiler.lexer.Token;

import java.util.List;

/**
 * AST 节点: 一元负号 (e.g., -x)
 */
public record NegateNode(Token token, ExpressionNode operand) implements ExpressionNode {

    @Override
    public int precedence() {
        return Precedence.NEGATE;
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        return "NEGATE(" + operand + ")";
    }
}
