package org.csu.texmath.compiler.renderer;

import org.csu.texmath.common.exception.FormatException;
import org.csu.texmath.common.exception.InternalRenderException;
import org.csu.texmath.compiler.parser.ast.*;

import java.util.List;

/**
 * @author hidyouth
 * @description: 将 AST 转换为 TeX 数学标记
 *
 * 只在优先级和结合性需要时才插入括号：
 * <ul>
 *     <li>左结合运算 (+ - *)：左子节点优先级更低时加括号，右子节点优先级不高于当前节点时加括号；</li>
 *     <li>乘方 (^) 右结合：底数优先级不高于当前节点时加括号，指数优先级更低时加括号，指数总是用花括号分组；</li>
 *     <li>除法总是渲染为 \frac，本身即可定界，不需要括号。</li>
 * </ul>
 * 渲染器没有状态，可以被多个线程共享。
 */
public class LatexRenderer {

    private static final String LEFT_PAREN = "\\left(";
    private static final String RIGHT_PAREN = "\\right)";

    /**
     * @throws FormatException         非法标识符、未知函数或参数个数不符
     * @throws InternalRenderException 遇到没有渲染规则的节点类型
     */
    public String render(ExpressionNode node) {
        if (node instanceof BinaryExpressionNode binary) {
            return renderBinary(binary);
        }
        if (node instanceof NegateNode negate) {
            return "-" + renderOperand(negate.operand(), negate.precedence() > negate.operand().precedence());
        }
        if (node instanceof IdentifierNode identifier) {
            return renderIdentifier(identifier);
        }
        if (node instanceof NumberNode number) {
            return renderNumber(number);
        }
        if (node instanceof FunctionCallNode call) {
            return renderFunctionCall(call);
        }
        throw new InternalRenderException(node.token(), node.getClass().getSimpleName());
    }

    private String renderBinary(BinaryExpressionNode node) {
        BinaryOperator operator = node.operator();
        if (operator == BinaryOperator.DIVIDE) {
            return "\\frac{" + render(node.left()) + "}{" + render(node.right()) + "}";
        }

        int precedence = node.precedence();
        int leftPrecedence = node.left().precedence();
        int rightPrecedence = node.right().precedence();

        // 结合方向上的同级操作数不需要括号，另一侧的同级操作数必须加括号
        boolean wrapLeft = operator.isRightAssociative()
                ? leftPrecedence <= precedence
                : leftPrecedence < precedence;
        boolean wrapRight = operator.isRightAssociative()
                ? rightPrecedence < precedence
                : rightPrecedence <= precedence;

        String left = renderOperand(node.left(), wrapLeft);
        return switch (operator) {
            case ADD, SUBTRACT -> left + operator.symbol() + renderOperand(node.right(), wrapRight);
            case MULTIPLY -> left + " " + renderOperand(node.right(), wrapRight);
            // 指数总是放进花括号，否则 \left( 不能作为上标
            case POWER -> left + "^{" + renderOperand(node.right(), wrapRight) + "}";
            case DIVIDE -> throw new IllegalStateException("unreachable: division handled above");
        };
    }

    private String renderOperand(ExpressionNode operand, boolean parenthesize) {
        String markup = render(operand);
        return parenthesize ? LEFT_PAREN + markup + RIGHT_PAREN : markup;
    }

    private String renderIdentifier(IdentifierNode node) {
        String name = node.getName();
        if (name.length() == 1 && isLatinLetter(name.charAt(0))) {
            return name;
        }
        if (GreekLetters.contains(name)) {
            return "\\" + name;
        }
        throw new FormatException(node.token(), "identifier must be a Latin letter or Greek letter name");
    }

    private String renderNumber(NumberNode node) {
        String literal = node.getLiteral();
        int marker = indexOfExponent(literal);
        if (marker < 0) {
            return literal;
        }
        String mantissa = literal.substring(0, marker);
        String exponent = literal.substring(marker + 1);
        return mantissa + " \\times 10^{" + exponent + "}";
    }

    private String renderFunctionCall(FunctionCallNode node) {
        String name = node.getFunctionName();
        List<ExpressionNode> arguments = node.arguments();
        switch (name) {
            case "sqrt":
                requireArity(node, 1);
                return "\\sqrt{" + render(arguments.get(0)) + "}";
            case "abs":
                requireArity(node, 1);
                return "\\left|" + render(arguments.get(0)) + "\\right|";
            case "sin":
            case "cos":
                requireArity(node, 1);
                return "\\" + name + LEFT_PAREN + render(arguments.get(0)) + RIGHT_PAREN;
            default:
                throw new FormatException(node.token(), "unknown function '" + name + "'");
        }
    }

    private void requireArity(FunctionCallNode node, int expected) {
        int actual = node.arguments().size();
        if (actual != expected) {
            throw new FormatException(node.token(), String.format(
                    "function '%s' expects %d argument(s) but got %d", node.getFunctionName(), expected, actual));
        }
    }

    private static int indexOfExponent(String literal) {
        int lower = literal.indexOf('e');
        return lower >= 0 ? lower : literal.indexOf('E');
    }

    private static boolean isLatinLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
