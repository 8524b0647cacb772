package com.parsetrace.core.trace;

import com.parsetrace.api.outcome.Outcome;

/**
 * 事件类型
 */
public enum TraceEventType {
    OPEN("Open"),
    CLOSE_OK("Ok"),
    CLOSE_ERROR("Error"),
    CLOSE_FAILURE("Failure"),
    CLOSE_INCOMPLETE("Incomplete");

    private final String keyword;

    TraceEventType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * 渲染时使用的关键字
     */
    public String keyword() {
        return keyword;
    }

    public boolean isClose() {
        return this != OPEN;
    }

    public static TraceEventType closeOf(Outcome.Kind kind) {
        return switch (kind) {
            case SUCCESS -> CLOSE_OK;
            case ERROR -> CLOSE_ERROR;
            case FAILURE -> CLOSE_FAILURE;
            case INCOMPLETE -> CLOSE_INCOMPLETE;
        };
    }
}
