package com.parsetrace.api.outcome;

import lombok.EqualsAndHashCode;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * 解析结果（四分支的标签联合）
 * <p>
 * 由 {@link #getKind()} 区分分支，只有对应分支的字段有值：
 * <ul>
 *     <li>{@link Kind#SUCCESS}: remaining + value</li>
 *     <li>{@link Kind#ERROR}: 可恢复错误，上层组合子可以尝试其他分支</li>
 *     <li>{@link Kind#FAILURE}: 不可恢复错误，解析应立即终止</li>
 *     <li>{@link Kind#INCOMPLETE}: 输入不足，携带 {@link Needed}</li>
 * </ul>
 *
 * @param <I> 输入类型
 * @param <O> 产出值类型
 * @param <E> 错误类型
 */
@EqualsAndHashCode(doNotUseGetters = true)
public final class Outcome<I, O, E> {

    public enum Kind {
        SUCCESS,
        ERROR,
        FAILURE,
        INCOMPLETE
    }

    private final Kind kind;
    private final I remaining;
    private final O value;
    private final E error;
    private final Needed needed;

    private Outcome(Kind kind, I remaining, O value, E error, Needed needed) {
        this.kind = kind;
        this.remaining = remaining;
        this.value = value;
        this.error = error;
        this.needed = needed;
    }

    public static <I, O, E> Outcome<I, O, E> success(I remaining, O value) {
        return new Outcome<>(Kind.SUCCESS, remaining, value, null, null);
    }

    public static <I, O, E> Outcome<I, O, E> error(E error) {
        return new Outcome<>(Kind.ERROR, null, null, error, null);
    }

    public static <I, O, E> Outcome<I, O, E> failure(E error) {
        return new Outcome<>(Kind.FAILURE, null, null, error, null);
    }

    public static <I, O, E> Outcome<I, O, E> incomplete(Needed needed) {
        return new Outcome<>(Kind.INCOMPLETE, null, null, null, Objects.requireNonNull(needed, "needed"));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    /**
     * ERROR 或 FAILURE
     */
    public boolean isError() {
        return kind == Kind.ERROR || kind == Kind.FAILURE;
    }

    public I getRemaining() {
        requireKind(Kind.SUCCESS);
        return remaining;
    }

    public O getValue() {
        requireKind(Kind.SUCCESS);
        return value;
    }

    public E getError() {
        if (!isError()) {
            throw new IllegalStateException("Outcome is " + kind + ", not an error");
        }
        return error;
    }

    public Needed getNeeded() {
        requireKind(Kind.INCOMPLETE);
        return needed;
    }

    /**
     * 替换错误载荷，分支类型不变；非错误分支原样返回
     */
    public Outcome<I, O, E> mapError(UnaryOperator<E> mapper) {
        if (!isError()) {
            return this;
        }
        return new Outcome<>(kind, null, null, mapper.apply(error), null);
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Outcome is " + kind + ", not " + expected);
        }
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SUCCESS -> "Success(" + remaining + ", " + value + ")";
            case ERROR -> "Error(" + error + ")";
            case FAILURE -> "Failure(" + error + ")";
            case INCOMPLETE -> "Incomplete(" + needed + ")";
        };
    }
}
