package org.csu.texmath.compiler.parser.ast;

import org.csu.texmath.compiler.lexer.Token;

import java.util.List;

/**
 * @author hidyouth
 * @description: 所有 AST 节点的公共接口
 *
 * 节点集合是封闭的；每个节点在构造后不可变，独占自己的子节点（树中没有共享，也没有环）。
 */
public sealed interface ExpressionNode
        permits BinaryExpressionNode, NegateNode, IdentifierNode, NumberNode, FunctionCallNode {

    /**
     * 节点种类固有的优先级，不随输入文本变化。
     */
    int precedence();

    /**
     * 产生该节点的 Token，用于错误定位以及读取字面文本。
     */
    Token token();

    List<ExpressionNode> children();
}
