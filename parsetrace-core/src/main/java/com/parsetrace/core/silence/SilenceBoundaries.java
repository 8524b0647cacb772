package com.parsetrace.core.silence;

import com.parsetrace.core.trace.Trace;
import com.parsetrace.core.trace.TraceSink;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 静默边界栈与共享的丢弃缓冲区
 * <p>
 * 栈非空期间，所有埋点（无论 tag）都写入同一个缓冲区，不会出现在原通道中。
 * 嵌套的静默区域共用一个缓冲区，只依赖调用栈的严格先进后出。
 */
public class SilenceBoundaries {

    public static final String SILENT_TAG = "<silenced>";

    private final Deque<Integer> baselines = new ArrayDeque<>();

    // 永不实时打印
    private final Trace buffer = new Trace(SILENT_TAG, TraceSink.NOOP);

    /**
     * 进入静默区域，并把缓冲区层级对齐到基线
     */
    public void enter(int baseline) {
        baselines.push(baseline);
        buffer.setLevel(baseline);
    }

    public void exit() {
        if (baselines.isEmpty()) {
            throw new IllegalStateException("No active silence boundary to exit");
        }
        baselines.pop();
    }

    /**
     * 清空缓冲区中的事件
     *
     * @throws IllegalStateException 仍处于静默区域内时
     */
    public void clear() {
        if (isActive()) {
            throw new IllegalStateException("Cannot clear silenced events inside " + depth() + " active silence boundary(ies)");
        }
        buffer.clear();
    }

    public boolean isActive() {
        return !baselines.isEmpty();
    }

    public int depth() {
        return baselines.size();
    }

    public Trace buffer() {
        return buffer;
    }
}
