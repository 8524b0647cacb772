package com.parsetrace.core;

import com.parsetrace.api.outcome.ErrorEnricher;
import com.parsetrace.api.outcome.Parser;
import com.parsetrace.core.config.TraceConfig;
import com.parsetrace.core.config.TraceConfigLoader;
import com.parsetrace.core.trace.Trace;
import com.parsetrace.core.trace.TraceEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Function;

/**
 * 线程级追踪入口
 * <p>
 * 使用 ThreadLocal 为每个线程维护独立的 {@link TraceSession}，首次访问时按默认配置创建，
 * 线程之间互不共享。默认配置取自 classpath 上的 parsetrace.yml。
 */
@Slf4j
public final class Tracing {

    private static final ThreadLocal<TraceSession> SESSION = new ThreadLocal<>();

    private static volatile TraceConfig defaultConfig;

    private Tracing() {
    }

    /**
     * 获取当前线程的会话，不存在则创建
     */
    public static TraceSession current() {
        TraceSession session = SESSION.get();
        if (session == null) {
            session = TraceSession.create(defaultConfig());
            SESSION.set(session);
        }
        return session;
    }

    /**
     * 替换当前线程的会话（例如测试中注入自定义输出）
     */
    public static void install(TraceSession session) {
        if (session == null) {
            SESSION.remove();
        } else {
            SESSION.set(session);
        }
    }

    /**
     * 丢弃当前线程的会话，下次访问时重新创建
     * <p>
     * 会话可能仍被别处引用（例如通过 {@link #install} 注入），因此先清空其通道和丢弃缓冲区。
     */
    public static void clear() {
        TraceSession session = SESSION.get();
        if (session != null) {
            for (String tag : session.registry().tags()) {
                int level = session.levelOf(tag);
                if (level > 0) {
                    log.warn("Discarding trace '{}' with {} unclosed frame(s)", tag, level);
                }
            }
            if (session.isSilenced()) {
                log.warn("Discarding session inside an active silence boundary");
            } else {
                session.resetAll();
            }
        }
        SESSION.remove();
    }

    public static TraceConfig defaultConfig() {
        TraceConfig config = defaultConfig;
        if (config == null) {
            synchronized (Tracing.class) {
                config = defaultConfig;
                if (config == null) {
                    config = TraceConfigLoader.load();
                    defaultConfig = config;
                }
            }
        }
        return config;
    }

    /**
     * 设置之后新建会话使用的配置，已存在的会话不受影响；传 null 恢复为从 classpath 加载
     */
    public static void setDefaultConfig(TraceConfig config) {
        defaultConfig = config;
    }

    // ==================== 静态委托 ====================

    public static <I, O, E> Parser<I, O, E> wrap(String location, Parser<I, O, E> parser) {
        return lazy(s -> s.wrap(location, parser));
    }

    public static <I, O, E> Parser<I, O, E> wrapWithContext(String context, String location, Parser<I, O, E> parser) {
        return lazy(s -> s.wrapWithContext(context, location, parser));
    }

    public static <I, O, E> Parser<I, O, E> wrapTagged(String tag, String location, Parser<I, O, E> parser) {
        return lazy(s -> s.wrapTagged(tag, location, parser));
    }

    public static <I, O, E> Parser<I, O, E> wrap(String tag, String context, String location, Parser<I, O, E> parser) {
        return lazy(s -> s.wrap(tag, context, location, parser));
    }

    public static <I, O, E> Parser<I, O, E> wrap(String tag, String context, String location,
                                                 Parser<I, O, E> parser, ErrorEnricher<I, E> enricher) {
        return lazy(s -> s.wrap(tag, context, location, parser, enricher));
    }

    public static <I, O, E> Parser<I, O, E> silence(String location, Parser<I, O, E> parser) {
        return lazy(s -> s.silence(location, parser));
    }

    public static <I, O, E> Parser<I, O, E> silenceWithContext(String context, String location, Parser<I, O, E> parser) {
        return lazy(s -> s.silenceWithContext(context, location, parser));
    }

    public static <I, O, E> Parser<I, O, E> silence(String tag, String context, String location, Parser<I, O, E> parser) {
        return lazy(s -> s.silence(tag, context, location, parser));
    }

    public static <I, O, E> Parser<I, O, E> silence(String tag, String context, String location,
                                                    Parser<I, O, E> parser, ErrorEnricher<I, E> enricher) {
        return lazy(s -> s.silence(tag, context, location, parser, enricher));
    }

    public static String getTrace() {
        return current().getTrace();
    }

    public static String getTrace(String tag) {
        return current().getTrace(tag);
    }

    public static void printTrace() {
        current().printTrace();
    }

    public static void printTrace(String tag) {
        current().printTrace(tag);
    }

    public static String getSilencedTrace() {
        return current().getSilencedTrace();
    }

    public static List<TraceEvent> silencedEvents() {
        return current().silencedEvents();
    }

    public static boolean isSilenced() {
        return current().isSilenced();
    }

    public static void resetSilenced() {
        current().resetSilenced();
    }

    public static void activate() {
        current().activate();
    }

    public static void activate(String tag) {
        current().activate(tag);
    }

    public static void deactivate() {
        current().deactivate();
    }

    public static void deactivate(String tag) {
        current().deactivate(tag);
    }

    public static void reset() {
        current().reset();
    }

    public static void reset(String tag) {
        current().reset(tag);
    }

    public static void setMaxDepth(Integer maxDepth) {
        current().setMaxDepth(maxDepth);
    }

    public static void setMaxDepth(String tag, Integer maxDepth) {
        current().setMaxDepth(tag, maxDepth);
    }

    public static void setPrintImmediate(boolean printImmediate) {
        current().setPrintImmediate(printImmediate);
    }

    public static void setPrintImmediate(String tag, boolean printImmediate) {
        current().setPrintImmediate(tag, printImmediate);
    }

    public static Trace trace(String tag) {
        return current().registry().getOrCreate(tag);
    }

    /**
     * 解析器可能在别的线程构造、在当前线程执行，因此每次调用时才取当前线程的会话
     */
    private static <I, O, E> Parser<I, O, E> lazy(Function<TraceSession, Parser<I, O, E>> factory) {
        return input -> factory.apply(current()).parse(input);
    }
}
