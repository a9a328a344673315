package org.csu.texmath.compiler.parser.ast;

import org.csu.texmath.compiler.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST 节点: 表示一个函数调用, e.g., sqrt(x), sin(theta)
 * @param token     函数名 Token
 * @param arguments 参数列表，至少一个；参数个数在渲染时校验
 */
public record FunctionCallNode(Token token, List<ExpressionNode> arguments) implements ExpressionNode {

    public FunctionCallNode {
        arguments = List.copyOf(arguments);
    }

    public String getFunctionName() {
        return token.text();
    }

    @Override
    public int precedence() {
        return Precedence.ATOM;
    }

    @Override
    public List<ExpressionNode> children() {
        return arguments;
    }

    @Override
    public String toString() {
        return getFunctionName() + arguments.stream()
                .map(ExpressionNode::toString)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
