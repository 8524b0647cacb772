package com.parsetrace.core.render;

import com.parsetrace.core.trace.TraceEvent;
import com.parsetrace.core.trace.TraceEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PlainTraceRenderer 单元测试")
class PlainTraceRendererTest {

    private final TraceRenderer renderer = PlainTraceRenderer.INSTANCE;

    static TraceEvent open(int depth, String location, String context, String input) {
        return TraceEvent.builder()
                .depth(depth).location(location).context(context).input(input)
                .type(TraceEventType.OPEN)
                .build();
    }

    static TraceEvent close(int depth, String location, String context, String input,
                            TraceEventType type, String detail) {
        return TraceEvent.builder()
                .depth(depth).location(location).context(context).input(input)
                .type(type).detail(detail)
                .build();
    }

    @Nested
    @DisplayName("OPEN 行")
    class OpenLineTests {

        @Test
        @DisplayName("无 context")
        void withoutContext() {
            assertEquals("parse(\"ab\")\n", renderer.renderEvent(open(0, "parse", null, "ab")));
        }

        @Test
        @DisplayName("有 context 时放在 location 之后")
        void withContext() {
            assertEquals("parse[greeting](\"ab\")\n", renderer.renderEvent(open(0, "parse", "greeting", "ab")));
        }

        @Test
        @DisplayName("缩进与深度成正比")
        void indentShouldFollowDepth() {
            assertEquals("| | parse(\"ab\")\n", renderer.renderEvent(open(2, "parse", null, "ab")));
        }

        @Test
        @DisplayName("自定义缩进标记")
        void customIndent() {
            TraceRenderer dotted = new PlainTraceRenderer(". ");
            assertEquals(". parse(\"ab\")\n", dotted.renderEvent(open(1, "parse", null, "ab")));
        }
    }

    @Nested
    @DisplayName("CLOSE 行")
    class CloseLineTests {

        @Test
        @DisplayName("四种结果关键字")
        void keywords() {
            assertEquals("p(\"x\") -> Ok(\"x\")\n",
                    renderer.renderEvent(close(0, "p", null, "x", TraceEventType.CLOSE_OK, "\"x\"")));
            assertEquals("p(\"x\") -> Error(e)\n",
                    renderer.renderEvent(close(0, "p", null, "x", TraceEventType.CLOSE_ERROR, "e")));
            assertEquals("p(\"x\") -> Failure(f)\n",
                    renderer.renderEvent(close(0, "p", null, "x", TraceEventType.CLOSE_FAILURE, "f")));
            assertEquals("p(\"x\") -> Incomplete(Size(2))\n",
                    renderer.renderEvent(close(0, "p", null, "x", TraceEventType.CLOSE_INCOMPLETE, "Size(2)")));
        }

        @Test
        @DisplayName("context 追加在行尾")
        void contextShouldTrail() {
            assertEquals("| p(\"x\") -> Ok(1)[num]\n",
                    renderer.renderEvent(close(1, "p", "num", "x", TraceEventType.CLOSE_OK, "1")));
        }
    }

    @Test
    @DisplayName("Open(L, ab) + Close(Ok X) 应包含位置、输入、成功标记与载荷")
    void openThenCloseShouldContainEverything() {
        String text = renderer.render(List.of(
                open(0, "L", null, "ab"),
                close(0, "L", null, "ab", TraceEventType.CLOSE_OK, "X")));

        assertTrue(text.contains("L"));
        assertTrue(text.contains("ab"));
        assertTrue(text.contains("Ok"));
        assertTrue(text.contains("X"));
        assertEquals(2, text.lines().count());
    }

    @Test
    @DisplayName("空列表渲染为空字符串")
    void emptyShouldRenderEmpty() {
        assertEquals("", renderer.render(List.of()));
    }
}
