package com.parsetrace.core.trace;

import com.parsetrace.api.outcome.Outcome;
import com.parsetrace.core.render.PlainTraceRenderer;
import com.parsetrace.core.render.TraceRenderer;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * tag -> Trace 映射
 * <p>
 * 任何引用某个 tag 的操作都会按需创建对应通道。默认通道 {@link #DEFAULT_TAG} 始终存在。
 */
@Slf4j
public class TraceRegistry {

    public static final String DEFAULT_TAG = "default";

    private final Map<String, Trace> traces = new HashMap<>();
    private final TraceSink sink;
    private final TraceRenderer renderer;

    // 新建通道时应用的初始配置
    private final Consumer<Trace> initializer;

    public TraceRegistry() {
        this(TraceSink.NOOP, PlainTraceRenderer.INSTANCE, trace -> {
        });
    }

    public TraceRegistry(TraceSink sink, TraceRenderer renderer, Consumer<Trace> initializer) {
        this.sink = sink;
        this.renderer = renderer;
        this.initializer = initializer;
        getOrCreate(DEFAULT_TAG);
    }

    public Trace getOrCreate(String tag) {
        Objects.requireNonNull(tag, "tag");
        return traces.computeIfAbsent(tag, t -> {
            Trace trace = new Trace(t, sink);
            initializer.accept(trace);
            log.debug("Created trace channel '{}'", t);
            return trace;
        });
    }

    public Optional<Trace> find(String tag) {
        return Optional.ofNullable(traces.get(tag));
    }

    public Set<String> tags() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(traces.keySet()));
    }

    // ==================== 管理操作 ====================

    public void activate(String tag) {
        getOrCreate(tag).setActive(true);
        log.debug("Trace '{}' activated", tag);
    }

    public void deactivate(String tag) {
        getOrCreate(tag).setActive(false);
        log.debug("Trace '{}' deactivated", tag);
    }

    public void reset(String tag) {
        getOrCreate(tag).clear();
    }

    public void setMaxDepth(String tag, Integer maxDepth) {
        getOrCreate(tag).setMaxDepth(maxDepth);
        log.debug("Trace '{}' max depth set to {}", tag, maxDepth);
    }

    public void setPrintImmediate(String tag, boolean printImmediate) {
        getOrCreate(tag).setPrintImmediate(printImmediate);
    }

    /**
     * 全部销毁，只重建默认通道
     */
    public void clearAll() {
        traces.clear();
        getOrCreate(DEFAULT_TAG);
    }

    // ==================== 记录 ====================

    public int open(String tag, String context, String input, String location) {
        return getOrCreate(tag).open(context, input, location);
    }

    public int close(String tag, String context, String input, String location, Outcome<?, ?, ?> outcome) {
        return getOrCreate(tag).close(context, input, location, outcome);
    }

    /**
     * 当前层级，tag 不存在时为 0
     */
    public int levelOf(String tag) {
        Trace trace = traces.get(tag);
        return trace == null ? 0 : trace.getLevel();
    }

    // ==================== 渲染 ====================

    public String render(String tag) {
        Trace trace = traces.get(tag);
        if (trace == null) {
            return noTraceFound(tag);
        }
        return trace.render(renderer);
    }

    public TraceRenderer getRenderer() {
        return renderer;
    }

    public static String noTraceFound(String tag) {
        return "No trace found for tag '" + tag + "'";
    }
}
