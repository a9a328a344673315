package org.csu.texmath.common.exception;

import org.csu.texmath.compiler.lexer.Token;

/**
 * @author hidyouth
 */
public class ParseException extends ExpressionException {

    /**
     * 输入提前结束时使用，不关联任何 Token。
     */
    public ParseException(String expected) {
        super(ErrorKind.SYNTAX, null,
                String.format("Syntax Error at end of input: Expected %s", expected));
    }

    public ParseException(Token token, String expected) {
        super(ErrorKind.SYNTAX, token,
                String.format("Syntax Error at offset %d: Expected %s, but found '%s' (%s)",
                        token.offset(),
                        expected,
                        token.text(),
                        token.type()));
    }
}
