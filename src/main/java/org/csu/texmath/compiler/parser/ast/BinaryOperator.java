package org.csu.texmath.compiler.parser.ast;

/**
 * 二元运算符及其优先级和结合性。
 */
public enum BinaryOperator {
    ADD("+", Precedence.ADDITIVE, false),
    SUBTRACT("-", Precedence.ADDITIVE, false),
    MULTIPLY("*", Precedence.MULTIPLICATIVE, false),
    DIVIDE("/", Precedence.MULTIPLICATIVE, false),
    POWER("^", Precedence.POWER, true);

    private final String symbol;
    private final int precedence;
    private final boolean rightAssociative;

    BinaryOperator(String symbol, int precedence, boolean rightAssociative) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.rightAssociative = rightAssociative;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return rightAssociative;
    }

    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Not a binary operator: " + symbol);
    }
}
