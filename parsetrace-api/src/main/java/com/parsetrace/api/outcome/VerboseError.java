package com.parsetrace.api.outcome;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 携带面包屑链的错误类型
 * <p>
 * 第一条为原始错误，后续为逐层追加的上下文。不可变，每次追加返回新实例。
 */
@EqualsAndHashCode
public final class VerboseError<I> {

    @Value
    public static class Entry<I> {
        I input;
        String kind;
        String message;

        @Override
        public String toString() {
            return kind + "(" + message + ") at \"" + input + "\"";
        }
    }

    private final List<Entry<I>> entries;

    private VerboseError(List<Entry<I>> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    public static <I> VerboseError<I> of(I input, String message) {
        List<Entry<I>> entries = new ArrayList<>();
        entries.add(new Entry<>(input, "Error", message));
        return new VerboseError<>(entries);
    }

    public VerboseError<I> withContext(I input, String location, String context) {
        List<Entry<I>> next = new ArrayList<>(entries);
        next.add(new Entry<>(input, "Context", location + "[" + context + "]"));
        return new VerboseError<>(next);
    }

    public List<Entry<I>> getEntries() {
        return entries;
    }

    /**
     * 是否含有指定位置与上下文的面包屑
     */
    public boolean hasBreadcrumb(String location, String context) {
        String expected = location + "[" + context + "]";
        return entries.stream()
                .anyMatch(e -> "Context".equals(e.getKind()) && expected.equals(e.getMessage()));
    }

    public static <I> ErrorEnricher<I, VerboseError<I>> enricher() {
        return (location, context, input, error) -> error.withContext(input, location, context);
    }

    @Override
    public String toString() {
        return "VerboseError" + entries;
    }
}
