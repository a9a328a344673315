package org.csu.texmath.compiler.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的表达式字符串分解为一系列的Token。
 * 匹配优先级：数字 > 标识符 > 单个非空白字符。词法分析永远不会失败，
 * 无法识别的字符同样成为一个 OPERATOR Token，由语法分析器决定其是否合法。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表，不含结束标记
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        skipWhitespace();
        while (position < input.length()) {
            tokens.add(nextToken());
            skipWhitespace();
        }
        return tokens;
    }

    private Token nextToken() {
        char currentChar = peek();

        if (isDigit(currentChar)) {
            return readNumber();
        }

        if (isLetter(currentChar)) {
            return readIdentifier();
        }

        return consumeAndReturn(String.valueOf(currentChar));
    }

    private Token readIdentifier() {
        int startPos = position;
        while (position < input.length() && isLetterOrDigit(peek())) {
            advance();
        }
        return new Token(TokenType.IDENTIFIER, input.substring(startPos, position), startPos);
    }

    private Token readNumber() {
        int startPos = position;
        skipDigits();

        // 小数部分：只有 '.' 后面紧跟数字时才算入
        if (peek() == '.' && isDigit(peekAt(1))) {
            advance(); // 消耗掉 '.'
            skipDigits();
        }

        // 指数部分：e/E，可选符号，至少一位数字
        if (peek() == 'e' || peek() == 'E') {
            int signWidth = (peekAt(1) == '+' || peekAt(1) == '-') ? 1 : 0;
            if (isDigit(peekAt(1 + signWidth))) {
                position += 1 + signWidth;
                skipDigits();
            }
        }

        return new Token(TokenType.NUMBER, input.substring(startPos, position), startPos);
    }

    // --- 辅助方法 ---

    private void skipDigits() {
        while (position < input.length() && isDigit(peek())) {
            advance();
        }
    }

    private void skipWhitespace() {
        while (position < input.length() && isWhitespace(peek())) {
            advance();
        }
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekAt(int distance) {
        if (position + distance >= input.length()) return '\0';
        return input.charAt(position + distance);
    }

    private void advance() {
        position++;
    }

    private Token consumeAndReturn(String lexeme) {
        Token token = new Token(TokenType.OPERATOR, lexeme, position);
        advance();
        return token;
    }

    // 包括不换行空格 (U+00A0) 等 isWhitespace 不认的空白
    private boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
