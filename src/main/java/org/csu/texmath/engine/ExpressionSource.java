package org.csu.texmath.engine;

/**
 * 提供原始表达式字符串的外部来源，例如输入框或控制台。
 */
@FunctionalInterface
public interface ExpressionSource {
    String read();
}
