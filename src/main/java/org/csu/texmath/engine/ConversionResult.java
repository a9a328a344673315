package org.csu.texmath.engine;

import org.csu.texmath.common.exception.ErrorKind;
import org.csu.texmath.common.exception.ExpressionException;

import java.util.Optional;

/**
 * 封装一次转换的结果：要么是排版标记，要么是错误信息。
 *
 * @param markup  成功时的 TeX 标记，失败时为 null
 * @param kind    失败时的错误种类，成功时为 null
 * @param message 失败时的错误信息，成功时为 null
 * @param span    失败时引发错误的 Token 区间；无法定位（输入结尾）时为空
 */
public record ConversionResult(
        String markup,
        ErrorKind kind,
        String message,
        Optional<TokenSpan> span
) {
    // 静态工厂方法，用于成功返回
    public static ConversionResult success(String markup) {
        return new ConversionResult(markup, null, null, Optional.empty());
    }

    // 静态工厂方法，用于失败返回
    public static ConversionResult failure(ExpressionException e) {
        return new ConversionResult(null, e.getKind(), e.getMessage(), e.getSpan());
    }

    public boolean isSuccess() {
        return kind == null;
    }
}
