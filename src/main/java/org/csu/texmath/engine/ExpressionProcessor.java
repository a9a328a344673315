package org.csu.texmath.engine;

import lombok.Getter;

/**
 * @author hidyouth
 * @description: 连接外部来源与两个输出端
 *
 * 每次 {@link #process()} 从来源读取一个表达式，转换后把结果交给且仅交给一个输出端。
 */
public class ExpressionProcessor {

    private final MathConverter converter;
    private final ExpressionSource source;
    private final MarkupSink markupSink;
    private final ErrorSink errorSink;

    @Getter
    private int successCount;
    @Getter
    private int failureCount;

    public ExpressionProcessor(ExpressionSource source, MarkupSink markupSink, ErrorSink errorSink) {
        this(new MathConverter(), source, markupSink, errorSink);
    }

    public ExpressionProcessor(MathConverter converter, ExpressionSource source,
                               MarkupSink markupSink, ErrorSink errorSink) {
        this.converter = converter;
        this.source = source;
        this.markupSink = markupSink;
        this.errorSink = errorSink;
    }

    /**
     * @return 本次转换的结果
     */
    public ConversionResult process() {
        ConversionResult result = converter.convert(source.read());
        if (result.isSuccess()) {
            successCount++;
            markupSink.accept(result.markup());
        } else {
            failureCount++;
            errorSink.accept(result.message(), result.span());
        }
        return result;
    }
}
