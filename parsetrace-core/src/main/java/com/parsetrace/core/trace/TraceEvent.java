package com.parsetrace.core.trace;

import lombok.Builder;
import lombok.Value;

/**
 * 一条追踪事件（不可变）
 * <p>
 * OPEN 的 depth 是自增前的层级，CLOSE 的 depth 是自减后的层级，
 * 因此成对的 OPEN/CLOSE 深度相同，顺序日志即可还原成树。
 */
@Value
@Builder
public class TraceEvent {
    int depth;
    String location;
    String context; // 可为空
    String input; // 输入快照
    TraceEventType type;
    String detail; // CLOSE 的格式化载荷，OPEN 为 null

    public boolean hasContext() {
        return context != null;
    }
}
