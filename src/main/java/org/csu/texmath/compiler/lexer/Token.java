package org.csu.texmath.compiler.lexer;

/**
 * @param type   词法单元的类型 (种别码)
 * @param text   词法单元的原始文本 (词素值)
 * @param offset 首字符在源字符串中的下标
 */
public record Token(TokenType type, String text, int offset) {

    public int length() {
        return text.length();
    }

    public boolean is(String operator) {
        return type == TokenType.OPERATOR && text.equals(operator);
    }

    @Override
    public String toString() {
        return String.format("Token[Type=%-10s, Text='%s', Offset=%d]", type, text, offset);
    }
}
