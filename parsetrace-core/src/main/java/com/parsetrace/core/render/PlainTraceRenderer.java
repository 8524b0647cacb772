package com.parsetrace.core.render;

import com.parsetrace.core.trace.TraceEvent;

/**
 * 无颜色渲染
 * <pre>
 * location[context]("input")
 * | inner("input") -&gt; Ok(value)
 * location("input") -&gt; Error(e)[context]
 * </pre>
 */
public class PlainTraceRenderer implements TraceRenderer {

    public static final String DEFAULT_INDENT = "| ";

    public static final PlainTraceRenderer INSTANCE = new PlainTraceRenderer(DEFAULT_INDENT);

    private final String indent;

    public PlainTraceRenderer(String indent) {
        this.indent = indent;
    }

    @Override
    public String renderEvent(TraceEvent event) {
        StringBuilder sb = new StringBuilder();
        sb.append(indent.repeat(event.getDepth()));
        sb.append(event.getLocation());

        if (!event.getType().isClose()) {
            if (event.hasContext()) {
                sb.append('[').append(event.getContext()).append(']');
            }
            sb.append("(\"").append(event.getInput()).append("\")");
        } else {
            sb.append("(\"").append(event.getInput()).append("\") -> ")
                    .append(event.getType().keyword())
                    .append('(').append(event.getDetail()).append(')');
            if (event.hasContext()) {
                sb.append('[').append(event.getContext()).append(']');
            }
        }
        return sb.append('\n').toString();
    }
}
