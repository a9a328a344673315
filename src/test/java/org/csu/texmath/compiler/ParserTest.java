package org.csu.texmath.compiler;

import org.csu.texmath.common.exception.ErrorKind;
import org.csu.texmath.common.exception.ParseException;
import org.csu.texmath.compiler.lexer.Lexer;
import org.csu.texmath.compiler.lexer.Token;
import org.csu.texmath.compiler.parser.Parser;
import org.csu.texmath.compiler.parser.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: Parser 类的单元测试
 */
public class ParserTest {

    private ExpressionNode parse(String input) {
        System.out.println("Input: " + input);
        List<Token> tokens = new Lexer(input).tokenize();
        System.out.println("Tokens: " + tokens);
        ExpressionNode ast = new Parser(tokens).parse();
        System.out.println("Generated AST: " + ast);
        return ast;
    }

    private ParseException parseFailure(String input) {
        ParseException e = assertThrows(ParseException.class, () -> parse(input));
        System.out.println("Error: " + e.getMessage());
        assertEquals(ErrorKind.SYNTAX, e.getKind());
        return e;
    }

    private static BinaryExpressionNode binary(ExpressionNode node, BinaryOperator expected) {
        assertTrue(node instanceof BinaryExpressionNode, "Expected a binary node but got " + node);
        BinaryExpressionNode binary = (BinaryExpressionNode) node;
        assertEquals(expected, binary.operator());
        return binary;
    }

    private static void assertIdentifier(ExpressionNode node, String name) {
        assertTrue(node instanceof IdentifierNode, "Expected an identifier but got " + node);
        assertEquals(name, ((IdentifierNode) node).getName());
    }

    @Test
    void testSubtractionIsLeftAssociative() {
        System.out.println("--- Running test: testSubtractionIsLeftAssociative ---");
        BinaryExpressionNode root = binary(parse("a-b-c"), BinaryOperator.SUBTRACT);
        BinaryExpressionNode inner = binary(root.left(), BinaryOperator.SUBTRACT);
        assertIdentifier(inner.left(), "a");
        assertIdentifier(inner.right(), "b");
        assertIdentifier(root.right(), "c");
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testPowerIsRightAssociative() {
        System.out.println("--- Running test: testPowerIsRightAssociative ---");
        BinaryExpressionNode root = binary(parse("a^b^c"), BinaryOperator.POWER);
        assertIdentifier(root.left(), "a");
        BinaryExpressionNode exponent = binary(root.right(), BinaryOperator.POWER);
        assertIdentifier(exponent.left(), "b");
        assertIdentifier(exponent.right(), "c");
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testMultiplicationBindsTighterThanAddition() {
        System.out.println("--- Running test: testMultiplicationBindsTighterThanAddition ---");
        BinaryExpressionNode root = binary(parse("a+b*c/d"), BinaryOperator.ADD);
        BinaryExpressionNode divide = binary(root.right(), BinaryOperator.DIVIDE);
        binary(divide.left(), BinaryOperator.MULTIPLY);
        assertEquals(Precedence.ADDITIVE, root.precedence());
        assertEquals(Precedence.MULTIPLICATIVE, divide.precedence());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUnaryMinusWrapsPower() {
        System.out.println("--- Running test: testUnaryMinusWrapsPower ---");
        ExpressionNode node = parse("-x^2");
        assertTrue(node instanceof NegateNode);
        NegateNode negate = (NegateNode) node;
        assertEquals(Precedence.NEGATE, negate.precedence());
        BinaryExpressionNode power = binary(negate.operand(), BinaryOperator.POWER);
        assertIdentifier(power.left(), "x");
        assertTrue(power.right() instanceof NumberNode);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testDoubleNegation() {
        System.out.println("--- Running test: testDoubleNegation ---");
        ExpressionNode node = parse("--x");
        assertTrue(node instanceof NegateNode);
        ExpressionNode inner = ((NegateNode) node).operand();
        assertTrue(inner instanceof NegateNode);
        assertIdentifier(((NegateNode) inner).operand(), "x");
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUnaryPlusIsDiscarded() {
        System.out.println("--- Running test: testUnaryPlusIsDiscarded ---");
        assertIdentifier(parse("+++x"), "x");
        BinaryExpressionNode sum = binary(parse("a + +b"), BinaryOperator.ADD);
        assertIdentifier(sum.right(), "b");
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testParenthesesAddNoNode() {
        System.out.println("--- Running test: testParenthesesAddNoNode ---");
        ExpressionNode node = parse("((x))");
        assertIdentifier(node, "x");
        assertEquals(2, node.token().offset());
        assertTrue(node.children().isEmpty());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testFunctionCallArguments() {
        System.out.println("--- Running test: testFunctionCallArguments ---");
        ExpressionNode node = parse("f(x, y+1)");
        assertTrue(node instanceof FunctionCallNode);
        FunctionCallNode call = (FunctionCallNode) node;
        assertEquals("f", call.getFunctionName());
        assertEquals(Precedence.ATOM, call.precedence());
        assertEquals(2, call.arguments().size());
        assertIdentifier(call.arguments().get(0), "x");
        binary(call.arguments().get(1), BinaryOperator.ADD);
        assertEquals(call.arguments(), call.children());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testParsingIsDeterministic() {
        System.out.println("--- Running test: testParsingIsDeterministic ---");
        String input = "sqrt(a^2 + b^2) / -(c - 1.5e3)";
        assertEquals(parse(input), parse(input));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEndOfInputHasNoToken() {
        System.out.println("--- Running test: testEndOfInputHasNoToken ---");
        assertNull(parseFailure("2+").getToken());
        assertNull(parseFailure("").getToken());
        assertNull(parseFailure("(a+b").getToken());
        assertNull(parseFailure("f(x,").getToken());
        assertTrue(parseFailure("2+").getSpan().isEmpty());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUnexpectedTokenIsReported() {
        System.out.println("--- Running test: testUnexpectedTokenIsReported ---");
        ParseException e = parseFailure("2+*3");
        assertEquals("*", e.getToken().text());
        assertEquals(2, e.getToken().offset());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEmptyArgumentListIsRejected() {
        System.out.println("--- Running test: testEmptyArgumentListIsRejected ---");
        ParseException e = parseFailure("f()");
        assertEquals(")", e.getToken().text());
        assertEquals(2, e.getToken().offset());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testMissingSeparatorInArgumentList() {
        System.out.println("--- Running test: testMissingSeparatorInArgumentList ---");
        ParseException e = parseFailure("f(a b)");
        assertEquals("b", e.getToken().text());
        assertEquals(4, e.getToken().offset());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTrailingTokensAreRejected() {
        System.out.println("--- Running test: testTrailingTokensAreRejected ---");
        assertEquals("b", parseFailure("a b").getToken().text());
        assertEquals(")", parseFailure("(x))").getToken().text());
        assertEquals("x", parseFailure("2x").getToken().text());
        System.out.println("Result: Test PASSED.\n");
    }
}
