package com.parsetrace.core.render;

import com.parsetrace.core.trace.TraceEvent;

import java.util.List;

/**
 * 事件日志渲染器，纯函数，不修改事件
 */
public interface TraceRenderer {

    /**
     * 渲染单条事件，包含结尾换行
     */
    String renderEvent(TraceEvent event);

    /**
     * 按存储顺序渲染全部事件
     */
    default String render(List<TraceEvent> events) {
        StringBuilder sb = new StringBuilder();
        for (TraceEvent event : events) {
            sb.append(renderEvent(event));
        }
        return sb.toString();
    }

    static TraceRenderer of(boolean colored, String indent) {
        return colored ? new AnsiTraceRenderer(indent) : new PlainTraceRenderer(indent);
    }
}
