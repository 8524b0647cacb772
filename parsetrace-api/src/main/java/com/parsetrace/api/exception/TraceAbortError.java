package com.parsetrace.api.exception;

/**
 * 追踪中止错误
 * <p>
 * 表示埋点契约被破坏或触发了深度保护。继承 {@link Error} 而非 {@link Exception}，
 * 业务解析器中常见的 {@code catch (Exception e)} 不会吞掉它。
 * 需要在中止后继续运行的调用方，应在外层显式捕获本类型后再恢复线程。
 */
public class TraceAbortError extends Error {

    private final String tag;

    public TraceAbortError(String tag, String message) {
        super(message);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
