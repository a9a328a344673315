package org.csu.texmath.cli.tool;

import org.csu.texmath.engine.TokenSpan;

import java.util.Optional;

/**
 * 一个可重用的工具类，在原始输入下方画出 ^ 标记，指出出错的 Token。
 */
public class ErrorHighlighter {

    private static final String INDENT = "  ";

    /**
     * @param source 原始输入
     * @param span   出错 Token 的区间；为空时标记在输入末尾之后
     * @return 两行文本：输入本身和标记行
     */
    public static String highlight(String source, Optional<TokenSpan> span) {
        int start = span.map(TokenSpan::offset).orElse(source.length());
        int length = span.map(TokenSpan::length).orElse(1);
        // 越界的区间压回输入范围内
        start = Math.max(0, Math.min(start, source.length()));
        length = Math.max(1, length);

        StringBuilder sb = new StringBuilder();
        sb.append(INDENT).append(source).append("\n");
        sb.append(INDENT);
        for (int i = 0; i < start; i++) {
            // 保留制表符，使标记与输入对齐
            sb.append(source.charAt(i) == '\t' ? '\t' : ' ');
        }
        sb.append("^".repeat(length));
        return sb.toString();
    }
}
