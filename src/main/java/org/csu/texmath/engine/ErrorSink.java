package org.csu.texmath.engine;

import java.util.Optional;

/**
 * 接收错误信息的外部组件。
 * span 存在时应高亮原始输入中对应的子串；为空表示错误位于输入结尾或无法定位。
 */
@FunctionalInterface
public interface ErrorSink {
    void accept(String message, Optional<TokenSpan> span);
}
