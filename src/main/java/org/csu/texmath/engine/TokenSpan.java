package org.csu.texmath.engine;

import org.csu.texmath.compiler.lexer.Token;

/**
 * 源字符串中的一段区间 [offset, offset + length)，用于高亮出错的 Token。
 */
public record TokenSpan(int offset, int length) {

    public static TokenSpan of(Token token) {
        return new TokenSpan(token.offset(), token.length());
    }
}
