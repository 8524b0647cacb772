package com.parsetrace.api.exception;

/**
 * 追踪配置异常
 * 配置文件无法解析或取值不合法时抛出。
 */
public class TraceConfigException extends RuntimeException {

    private final String key;

    public TraceConfigException(String message) {
        super(message);
        this.key = null;
    }

    public TraceConfigException(String key, String message) {
        super(message);
        this.key = key;
    }

    public TraceConfigException(String message, Throwable cause) {
        super(message, cause);
        this.key = null;
    }

    public String getKey() {
        return key;
    }
}
