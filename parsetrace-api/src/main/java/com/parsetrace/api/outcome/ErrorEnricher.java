package com.parsetrace.api.outcome;

/**
 * 错误增强能力
 * <p>
 * 带 context 的埋点在得到 ERROR / FAILURE 时调用，把 (location, context) 作为面包屑挂到错误上。
 * 未提供时跳过增强，结果原样返回。
 */
@FunctionalInterface
public interface ErrorEnricher<I, E> {

    /**
     * @param location 产生错误的埋点位置
     * @param context  埋点上的上下文标签，不为 null
     * @param input    该埋点收到的输入
     * @param error    原始错误
     * @return 增强后的错误，必须保留原始内容
     */
    E attach(String location, String context, I input, E error);
}
