package com.parsetrace.core.render;

import com.parsetrace.core.trace.TraceEvent;
import com.parsetrace.core.trace.TraceEventType;

import static com.parsetrace.core.render.Ansi.*;

/**
 * 彩色渲染
 * 信息与 {@link PlainTraceRenderer} 一致：Ok 绿、Error 红、Failure 品红、Incomplete 黄，
 * 输入用亮蓝底色，上下文用青色底色。
 */
public class AnsiTraceRenderer implements TraceRenderer {

    private final String indent;

    public AnsiTraceRenderer(String indent) {
        this.indent = indent;
    }

    @Override
    public String renderEvent(TraceEvent event) {
        String prefix = paint(FG_WHITE, indent.repeat(event.getDepth()));
        StringBuilder sb = new StringBuilder();

        if (event.getType() == TraceEventType.OPEN) {
            sb.append(prefix).append(event.getLocation());
            if (event.hasContext()) {
                sb.append('[').append(paint(BG_CYAN, event.getContext())).append(']');
            }
            sb.append("(\"").append(paint(BG_BRIGHT_BLUE, event.getInput())).append("\")");
        } else {
            String line = event.getLocation()
                    + "(\"" + event.getInput() + "\") -> "
                    + event.getType().keyword() + "(" + event.getDetail() + ")";
            sb.append(prefix).append(paint(colorOf(event.getType()), line));
            if (event.hasContext()) {
                sb.append('[').append(paint(BG_CYAN, event.getContext())).append(']');
            }
        }
        return sb.append('\n').toString();
    }

    private static String colorOf(TraceEventType type) {
        return switch (type) {
            case CLOSE_OK -> FG_GREEN;
            case CLOSE_ERROR -> FG_RED;
            case CLOSE_FAILURE -> FG_MAGENTA;
            case OPEN, CLOSE_INCOMPLETE -> FG_YELLOW;
        };
    }
}
