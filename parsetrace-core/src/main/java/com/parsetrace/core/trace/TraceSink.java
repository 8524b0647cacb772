package com.parsetrace.core.trace;

/**
 * 实时输出目标，开启 printImmediate 的通道每记录一条事件就回调一次
 */
@FunctionalInterface
public interface TraceSink {

    void emit(TraceEvent event);

    TraceSink NOOP = event -> { /* nothing */ };
}
