package org.csu.texmath.common.exception;

import lombok.Getter;
import org.csu.texmath.compiler.lexer.Token;
import org.csu.texmath.engine.TokenSpan;

import java.util.Optional;

/**
 * @author hidyouth
 * @description: 表达式转换流水线中所有错误的基类
 *
 * 携带错误种类以及（可定位时）引发错误的 Token，供界面层高亮对应的子串。
 */
@Getter
public abstract class ExpressionException extends RuntimeException {

    private final ErrorKind kind;
    /** 引发错误的 Token; 在输入结尾处出错时为 null */
    private final Token token;

    protected ExpressionException(ErrorKind kind, Token token, String message) {
        super(message);
        this.kind = kind;
        this.token = token;
    }

    public Optional<TokenSpan> getSpan() {
        return Optional.ofNullable(token).map(TokenSpan::of);
    }
}
