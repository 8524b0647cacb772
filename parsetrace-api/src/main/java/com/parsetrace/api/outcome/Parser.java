package com.parsetrace.api.outcome;

/**
 * 被追踪的解析计算
 * 对追踪器而言是不透明的：只关心输入和结果。
 */
@FunctionalInterface
public interface Parser<I, O, E> {

    Outcome<I, O, E> parse(I input);
}
