package com.parsetrace.core.config;

import com.parsetrace.api.exception.TraceConfigException;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 对应 parsetrace.yml 的根节点
 */
@Getter
@Setter
public class TraceSettings {

    private boolean enabled = true;
    private boolean colored = false;
    private String indent;
    private int maxInputLength = 0;
    private boolean printImmediate = false;
    private Integer maxDepth;

    private Map<String, TagSettings> tags = new LinkedHashMap<>();

    /**
     * 验证
     */
    public void validate() {
        if (maxInputLength < 0) {
            throw new TraceConfigException("maxInputLength", "maxInputLength must not be negative: " + maxInputLength);
        }
        if (maxDepth != null && maxDepth < 0) {
            throw new TraceConfigException("maxDepth", "maxDepth must not be negative: " + maxDepth);
        }
        if (indent != null && indent.isEmpty()) {
            throw new TraceConfigException("indent", "indent must not be empty");
        }
        if (tags == null) {
            return;
        }
        for (Map.Entry<String, TagSettings> entry : tags.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new TraceConfigException("tags", "tag name must not be blank");
            }
            TagSettings ts = entry.getValue();
            if (ts != null && ts.getMaxDepth() != null && ts.getMaxDepth() < 0) {
                throw new TraceConfigException("tags." + entry.getKey() + ".maxDepth",
                        "maxDepth must not be negative: " + ts.getMaxDepth());
            }
        }
    }

    public TraceConfig toConfig() {
        TraceConfig.TraceConfigBuilder builder = TraceConfig.builder()
                .enabled(enabled)
                .colored(colored)
                .maxInputLength(maxInputLength)
                .printImmediate(printImmediate)
                .maxDepth(maxDepth);
        if (indent != null) {
            builder.indent(indent);
        }
        if (tags != null) {
            Map<String, TagSettings> copy = new LinkedHashMap<>();
            tags.forEach((tag, ts) -> copy.put(tag, ts == null ? new TagSettings() : ts));
            builder.tags(copy);
        }
        return builder.build();
    }
}
