package com.parsetrace.api.outcome;

import lombok.EqualsAndHashCode;

/**
 * 输入不足时还需要多少数据
 * size 为 0 表示未知。
 */
@EqualsAndHashCode
public final class Needed {

    private static final Needed UNKNOWN = new Needed(0);

    private final int size;

    private Needed(int size) {
        this.size = size;
    }

    public static Needed unknown() {
        return UNKNOWN;
    }

    public static Needed size(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Needed size must be positive: " + size);
        }
        return new Needed(size);
    }

    public boolean isKnown() {
        return size > 0;
    }

    public int getSize() {
        return size;
    }

    @Override
    public String toString() {
        return isKnown() ? "Size(" + size + ")" : "Unknown";
    }
}
