package com.parsetrace.api.exception;

/**
 * 层级为 0 时执行 close
 * 说明 open/close 没有成对调用，属于埋点使用错误。
 */
public class UnbalancedCloseError extends TraceAbortError {

    private final String location;

    public UnbalancedCloseError(String tag, String location) {
        super(tag, "Cannot close at level 0: location=\"" + location + "\" (tag '" + tag + "')");
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
