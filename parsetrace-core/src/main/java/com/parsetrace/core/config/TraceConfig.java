package com.parsetrace.core.config;

import com.parsetrace.core.render.PlainTraceRenderer;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * 追踪会话配置
 * 构造会话时选定，运行期间不再改变（通道级开关仍可通过会话 API 调整）。
 */
@Getter
@Builder(toBuilder = true)
public class TraceConfig {

    // ==================== 总开关 ====================

    /**
     * 关闭后 wrap / silence 直接调用解析器，不记录任何事件
     */
    @Builder.Default
    private boolean enabled = true;

    // ==================== 渲染 ====================

    /**
     * 是否输出 ANSI 彩色
     */
    @Builder.Default
    private boolean colored = false;

    /**
     * 缩进标记，按深度重复
     */
    @Builder.Default
    private String indent = PlainTraceRenderer.DEFAULT_INDENT;

    /**
     * 输入快照最大长度，0 表示不截断
     */
    @Builder.Default
    private int maxInputLength = 0;

    // ==================== 新建通道的默认值 ====================

    /**
     * 新通道是否实时打印
     */
    @Builder.Default
    private boolean printImmediate = false;

    /**
     * 新通道的最大嵌套深度，null 表示不限制
     */
    private Integer maxDepth;

    /**
     * 按 tag 覆盖的通道设置，会话创建时立即应用
     */
    @Builder.Default
    private Map<String, TagSettings> tags = Collections.emptyMap();

    // ==================== 工厂方法 ====================

    public static TraceConfig defaults() {
        return TraceConfig.builder().build();
    }

    /**
     * 调试用：彩色 + 实时打印
     */
    public static TraceConfig verbose() {
        return TraceConfig.builder()
                .colored(true)
                .printImmediate(true)
                .build();
    }

    /**
     * 关闭追踪，仅保留错误增强
     */
    public static TraceConfig quiet() {
        return TraceConfig.builder()
                .enabled(false)
                .build();
    }

    @Override
    public String toString() {
        return String.format(
                "TraceConfig{enabled=%s, colored=%s, printImmediate=%s, maxDepth=%s, maxInputLength=%d, tags=%s}",
                enabled, colored, printImmediate, maxDepth, maxInputLength, tags == null ? "[]" : tags.keySet()
        );
    }
}
