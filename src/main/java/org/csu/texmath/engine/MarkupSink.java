package org.csu.texmath.engine;

/**
 * 接收最终 TeX 标记的外部组件，负责显示或排版。
 */
@FunctionalInterface
public interface MarkupSink {
    void accept(String markup);
}
