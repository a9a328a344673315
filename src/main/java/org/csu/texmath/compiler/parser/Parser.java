package org.csu.texmath.compiler.parser;

import org.csu.texmath.common.exception.ParseException;
import org.csu.texmath.compiler.lexer.Token;
import org.csu.texmath.compiler.lexer.TokenType;
import org.csu.texmath.compiler.parser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)
 *
 * <pre>
 * expr    ::= mulexpr { ('+'|'-') mulexpr }
 * mulexpr ::= powexpr { ('*'|'/') powexpr }
 * powexpr ::= {'+'} ('-' powexpr | atom ['^' powexpr])
 * atom    ::= identifier ['(' expr {',' expr} ')'] | number | '(' expr ')'
 * </pre>
 *
 * 每个 Parser 实例只用于一次解析。
 */
public class Parser {

    private final List<Token> tokens;
    private int position = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * 解析整个 Token 序列。成功返回时保证所有 Token 都已被消耗。
     * @throws ParseException 语法错误，或存在未消耗的尾部 Token
     */
    public ExpressionNode parse() {
        ExpressionNode expression = parseExpression();
        if (!isAtEnd()) {
            throw new ParseException(peek(), "end of input");
        }
        return expression;
    }

    private ExpressionNode parseExpression() {
        ExpressionNode left = parseMulExpression();
        while (match("+", "-")) {
            Token operator = previous();
            ExpressionNode right = parseMulExpression();
            left = new BinaryExpressionNode(BinaryOperator.fromSymbol(operator.text()), operator, left, right);
        }
        return left;
    }

    private ExpressionNode parseMulExpression() {
        ExpressionNode left = parsePowExpression();
        while (match("*", "/")) {
            Token operator = previous();
            ExpressionNode right = parsePowExpression();
            left = new BinaryExpressionNode(BinaryOperator.fromSymbol(operator.text()), operator, left, right);
        }
        return left;
    }

    private ExpressionNode parsePowExpression() {
        // 一元 '+' 没有任何效果，直接丢弃
        while (match("+")) {
            // no-op
        }
        // 负号先于原子判断，因此 -x^2 解析为 -(x^2)
        if (match("-")) {
            Token minus = previous();
            return new NegateNode(minus, parsePowExpression());
        }
        ExpressionNode base = parseAtom();
        if (match("^")) {
            Token caret = previous();
            // 右递归实现右结合
            ExpressionNode exponent = parsePowExpression();
            return new BinaryExpressionNode(BinaryOperator.POWER, caret, base, exponent);
        }
        return base;
    }

    private ExpressionNode parseAtom() {
        if (isAtEnd()) {
            throw new ParseException("an identifier, a number or '('");
        }
        if (check(TokenType.IDENTIFIER)) {
            Token name = advance();
            if (match("(")) {
                return parseFunctionCall(name);
            }
            return new IdentifierNode(name);
        }
        if (check(TokenType.NUMBER)) {
            return new NumberNode(advance());
        }
        if (match("(")) {
            // 括号不产生额外节点
            ExpressionNode expr = parseExpression();
            consume(")", "')' after expression");
            return expr;
        }
        throw new ParseException(peek(), "an identifier, a number or '('");
    }

    private FunctionCallNode parseFunctionCall(Token name) {
        List<ExpressionNode> arguments = new ArrayList<>();
        do {
            arguments.add(parseExpression());
        } while (match(","));
        consume(")", "',' or ')' in argument list of '" + name.text() + "'");
        return new FunctionCallNode(name, arguments);
    }

    private boolean match(String... operators) {
        for (String operator : operators) {
            if (checkOperator(operator)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(String operator, String message) {
        if (checkOperator(operator)) return advance();
        if (isAtEnd()) throw new ParseException(message);
        throw new ParseException(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkOperator(String operator) {
        if (isAtEnd()) return false;
        return peek().is(operator);
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return position >= tokens.size();
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
