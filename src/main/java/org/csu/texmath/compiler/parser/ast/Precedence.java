package org.csu.texmath.compiler.parser.ast;

/**
 * 各类节点固定的运算符优先级，数值越大结合越紧。
 * 只用于渲染时决定是否需要加括号。
 */
public final class Precedence {
    public static final int ADDITIVE = 1;
    public static final int MULTIPLICATIVE = 2;
    public static final int NEGATE = 3;
    public static final int POWER = 4;
    public static final int ATOM = 9;

    private Precedence() {
    }
}
