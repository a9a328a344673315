package org.csu.texmath.compiler.lexer;

/**
 * @author hidyouth
 * @description: 词法单元（Token）的种别码
 *
 * 表达式语言只有三种“单词”：标识符、数字和单字符运算符。
 * 种别由首字符决定。
 */
public enum TokenType {
    IDENTIFIER, // x, theta, sqrt, _tmp1
    NUMBER,     // 42, 3.14, 1.23e-4
    OPERATOR    // + - * / ^ ( ) , 以及任何其他非空白字符
}
