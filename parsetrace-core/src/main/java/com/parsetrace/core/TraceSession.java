package com.parsetrace.core;

import com.parsetrace.api.outcome.ErrorEnricher;
import com.parsetrace.api.outcome.Outcome;
import com.parsetrace.api.outcome.Parser;
import com.parsetrace.core.config.TagSettings;
import com.parsetrace.core.config.TraceConfig;
import com.parsetrace.core.render.TraceRenderer;
import com.parsetrace.core.silence.SilenceBoundaries;
import com.parsetrace.core.trace.Trace;
import com.parsetrace.core.trace.TraceEvent;
import com.parsetrace.core.trace.TraceRegistry;
import com.parsetrace.core.util.ValueFormatter;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.parsetrace.core.trace.TraceRegistry.DEFAULT_TAG;

/**
 * 追踪会话：埋点与管理操作的入口
 * <p>
 * 持有通道注册表、静默边界栈和输出目标。单线程使用，不做同步；
 * 需要按线程隔离时使用 {@link Tracing}。
 */
@Slf4j
public class TraceSession {

    private final TraceConfig config;
    private final TraceRegistry registry;
    private final SilenceBoundaries silence = new SilenceBoundaries();
    private final PrintStream out;
    private final ErrorEnricher<?, ?> errorEnricher;

    /**
     * @param config        为空时使用 {@link TraceConfig#defaults()}
     * @param out           打印目标，为空时使用 System.out
     * @param errorEnricher 会话级错误增强，可为空；必须能处理会话内所有解析器的错误类型
     */
    @Builder
    private TraceSession(TraceConfig config, PrintStream out, ErrorEnricher<?, ?> errorEnricher) {
        this.config = config != null ? config : TraceConfig.defaults();
        this.out = out != null ? out : System.out;
        this.errorEnricher = errorEnricher;

        TraceRenderer renderer = TraceRenderer.of(this.config.isColored(), this.config.getIndent());
        this.registry = new TraceRegistry(
                event -> this.out.print(renderer.renderEvent(event)),
                renderer,
                trace -> {
                    trace.setPrintImmediate(this.config.isPrintImmediate());
                    trace.setMaxDepth(this.config.getMaxDepth());
                });
        applyTagSettings(this.config.getTags());
        log.debug("Trace session created: {}", this.config);
    }

    public static TraceSession create() {
        return builder().build();
    }

    public static TraceSession create(TraceConfig config) {
        return builder().config(config).build();
    }

    private void applyTagSettings(Map<String, TagSettings> tags) {
        if (tags == null) {
            return;
        }
        tags.forEach((tag, settings) -> {
            Trace trace = registry.getOrCreate(tag);
            if (settings == null) {
                return;
            }
            if (settings.getActive() != null) {
                trace.setActive(settings.getActive());
            }
            if (settings.getPrintImmediate() != null) {
                trace.setPrintImmediate(settings.getPrintImmediate());
            }
            if (settings.getMaxDepth() != null) {
                trace.setMaxDepth(settings.getMaxDepth());
            }
        });
    }

    // ==================== 埋点 ====================

    public <I, O, E> Parser<I, O, E> wrap(String location, Parser<I, O, E> parser) {
        return wrap(DEFAULT_TAG, null, location, parser);
    }

    public <I, O, E> Parser<I, O, E> wrapWithContext(String context, String location, Parser<I, O, E> parser) {
        return wrap(DEFAULT_TAG, context, location, parser);
    }

    public <I, O, E> Parser<I, O, E> wrapTagged(String tag, String location, Parser<I, O, E> parser) {
        return wrap(tag, null, location, parser);
    }

    public <I, O, E> Parser<I, O, E> wrap(String tag, String context, String location, Parser<I, O, E> parser) {
        return wrap(tag, context, location, parser, sessionEnricher());
    }

    /**
     * 用 open/close 包裹解析器
     * <p>
     * 静默区域内改写到共享缓冲区。带 context 且结果为 ERROR / FAILURE 时，
     * 通过 enricher 把 (location, context) 挂到错误上。
     *
     * @param enricher 可为空，为空时不做增强
     */
    public <I, O, E> Parser<I, O, E> wrap(String tag, String context, String location,
                                          Parser<I, O, E> parser, ErrorEnricher<I, E> enricher) {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(parser, "parser");

        return input -> {
            if (!config.isEnabled()) {
                return enrich(location, context, input, parser.parse(input), enricher);
            }
            Trace target = silence.isActive() ? silence.buffer() : registry.getOrCreate(tag);
            String snapshot = ValueFormatter.snapshot(input, config.getMaxInputLength());

            target.open(context, snapshot, location);
            Outcome<I, O, E> outcome = parser.parse(input);
            target.close(context, snapshot, location, outcome);

            return enrich(location, context, input, outcome, enricher);
        };
    }

    public <I, O, E> Parser<I, O, E> silence(String location, Parser<I, O, E> parser) {
        return silence(DEFAULT_TAG, null, location, parser);
    }

    public <I, O, E> Parser<I, O, E> silenceWithContext(String context, String location, Parser<I, O, E> parser) {
        return silence(DEFAULT_TAG, context, location, parser);
    }

    public <I, O, E> Parser<I, O, E> silence(String tag, String context, String location, Parser<I, O, E> parser) {
        return silence(tag, context, location, parser, sessionEnricher());
    }

    /**
     * 静默整棵子树
     * <p>
     * 子树照常执行，但其中所有埋点写入丢弃缓冲区，不出现在 tag 对应通道的渲染结果中。
     * 缓冲区的缩进基线对齐到 tag 通道当前层级；已处于静默区域时沿用缓冲区当前层级。
     */
    public <I, O, E> Parser<I, O, E> silence(String tag, String context, String location,
                                             Parser<I, O, E> parser, ErrorEnricher<I, E> enricher) {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(parser, "parser");

        return input -> {
            if (!config.isEnabled()) {
                return enrich(location, context, input, parser.parse(input), enricher);
            }
            Trace buffer = silence.buffer();
            int baseline = silence.isActive() ? buffer.getLevel() : registry.levelOf(tag);
            String snapshot = ValueFormatter.snapshot(input, config.getMaxInputLength());

            Outcome<I, O, E> outcome;
            silence.enter(baseline);
            try {
                buffer.open(context, snapshot, location);
                outcome = parser.parse(input);
                buffer.close(context, snapshot, location, outcome);
            } finally {
                silence.exit();
            }
            return enrich(location, context, input, outcome, enricher);
        };
    }

    private static <I, O, E> Outcome<I, O, E> enrich(String location, String context, I input,
                                                     Outcome<I, O, E> outcome, ErrorEnricher<I, E> enricher) {
        if (context == null || enricher == null || !outcome.isError()) {
            return outcome;
        }
        return outcome.mapError(error -> enricher.attach(location, context, input, error));
    }

    @SuppressWarnings("unchecked")
    private <I, E> ErrorEnricher<I, E> sessionEnricher() {
        return (ErrorEnricher<I, E>) errorEnricher;
    }

    // ==================== 渲染与输出 ====================

    public String getTrace() {
        return getTrace(DEFAULT_TAG);
    }

    /**
     * 渲染指定通道；从未使用过的 tag 返回 "No trace found for tag '...'"
     */
    public String getTrace(String tag) {
        return registry.render(tag);
    }

    public void printTrace() {
        printTrace(DEFAULT_TAG);
    }

    public void printTrace(String tag) {
        out.print(getTrace(tag));
        out.flush();
    }

    /**
     * 丢弃缓冲区的渲染结果
     */
    public String getSilencedTrace() {
        return silence.buffer().render(registry.getRenderer());
    }

    public List<TraceEvent> silencedEvents() {
        return silence.buffer().getEvents();
    }

    public boolean isSilenced() {
        return silence.isActive();
    }

    /**
     * 清空丢弃缓冲区；静默区域内调用会抛出 IllegalStateException
     */
    public void resetSilenced() {
        silence.clear();
    }

    // ==================== 通道管理 ====================

    public void activate() {
        activate(DEFAULT_TAG);
    }

    public void activate(String tag) {
        registry.activate(tag);
    }

    public void deactivate() {
        deactivate(DEFAULT_TAG);
    }

    public void deactivate(String tag) {
        registry.deactivate(tag);
    }

    public void reset() {
        reset(DEFAULT_TAG);
    }

    public void reset(String tag) {
        registry.reset(tag);
    }

    public void setMaxDepth(Integer maxDepth) {
        setMaxDepth(DEFAULT_TAG, maxDepth);
    }

    /**
     * @param maxDepth null 表示取消限制
     */
    public void setMaxDepth(String tag, Integer maxDepth) {
        registry.setMaxDepth(tag, maxDepth);
    }

    public void setPrintImmediate(boolean printImmediate) {
        setPrintImmediate(DEFAULT_TAG, printImmediate);
    }

    public void setPrintImmediate(String tag, boolean printImmediate) {
        registry.setPrintImmediate(tag, printImmediate);
    }

    /**
     * 会话级清理：销毁所有通道并清空丢弃缓冲区，按配置重建 tag 设置
     */
    public void resetAll() {
        resetSilenced();
        registry.clearAll();
        applyTagSettings(config.getTags());
        log.debug("Trace session reset");
    }

    public int levelOf(String tag) {
        return registry.levelOf(tag);
    }

    public TraceRegistry registry() {
        return registry;
    }

    public TraceConfig getConfig() {
        return config;
    }
}
