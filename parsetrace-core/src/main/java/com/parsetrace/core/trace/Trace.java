package com.parsetrace.core.trace;

import com.parsetrace.api.exception.MaxDepthExceededError;
import com.parsetrace.api.exception.UnbalancedCloseError;
import com.parsetrace.api.outcome.Outcome;
import com.parsetrace.core.render.PlainTraceRenderer;
import com.parsetrace.core.render.TraceRenderer;
import com.parsetrace.core.util.ValueFormatter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个通道的追踪日志
 * <p>
 * 维护有序事件列表、当前嵌套层级以及通道配置（active / printImmediate / maxDepth）。
 * 不做同步，只能由所属线程访问。
 */
@Slf4j
public class Trace {

    private final String tag;
    private final List<TraceEvent> events = new ArrayList<>();
    private final TraceSink sink;

    private int level;
    private boolean active = true;
    private boolean printImmediate;
    private Integer maxDepth; // null 表示不限制

    public Trace(String tag) {
        this(tag, TraceSink.NOOP);
    }

    public Trace(String tag, TraceSink sink) {
        this.tag = tag;
        this.sink = sink;
    }

    /**
     * 记录一次进入
     *
     * @return 记录后的层级
     * @throws MaxDepthExceededError 配置了 maxDepth 且当前层级已达上限
     */
    public int open(String context, String input, String location) {
        if (!active) {
            return level;
        }
        if (maxDepth != null && level >= maxDepth) {
            log.error("Trace '{}' reached max depth {} at location '{}'", tag, maxDepth, location);
            throw new MaxDepthExceededError(tag, maxDepth);
        }

        TraceEvent event = TraceEvent.builder()
                .depth(level)
                .location(location)
                .context(context)
                .input(input)
                .type(TraceEventType.OPEN)
                .build();
        record(event);
        level++;
        return level;
    }

    /**
     * 记录一次退出及其结果
     *
     * @return 记录后的层级
     * @throws UnbalancedCloseError 层级为 0 时关闭
     */
    public int close(String context, String input, String location, Outcome<?, ?, ?> outcome) {
        if (!active) {
            return level;
        }
        if (level == 0) {
            log.error("Trace '{}' closed at level 0, location '{}'", tag, location);
            throw new UnbalancedCloseError(tag, location);
        }
        level--;

        TraceEvent event = TraceEvent.builder()
                .depth(level)
                .location(location)
                .context(context)
                .input(input)
                .type(TraceEventType.closeOf(outcome.getKind()))
                .detail(describe(outcome))
                .build();
        record(event);
        return level;
    }

    private void record(TraceEvent event) {
        events.add(event);
        if (printImmediate) {
            sink.emit(event);
        }
    }

    private static String describe(Outcome<?, ?, ?> outcome) {
        return switch (outcome.getKind()) {
            case SUCCESS -> ValueFormatter.format(outcome.getValue());
            case ERROR, FAILURE -> ValueFormatter.format(outcome.getError());
            case INCOMPLETE -> outcome.getNeeded().toString();
        };
    }

    /**
     * 强制设置层级，不记录事件。仅用于对齐静默缓冲区的缩进基线。
     */
    public void setLevel(int level) {
        if (level < 0) {
            throw new IllegalArgumentException("level must not be negative: " + level);
        }
        this.level = level;
    }

    /**
     * 清空事件并归零层级，配置保持不变
     */
    public void clear() {
        events.clear();
        level = 0;
    }

    public String render(TraceRenderer renderer) {
        return renderer.render(events);
    }

    // ==================== 访问器 ====================

    public String getTag() {
        return tag;
    }

    public List<TraceEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public int getLevel() {
        return level;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isPrintImmediate() {
        return printImmediate;
    }

    public void setPrintImmediate(boolean printImmediate) {
        this.printImmediate = printImmediate;
    }

    public Integer getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(Integer maxDepth) {
        if (maxDepth != null && maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    @Override
    public String toString() {
        return render(PlainTraceRenderer.INSTANCE);
    }
}
