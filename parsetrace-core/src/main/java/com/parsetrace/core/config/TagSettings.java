package com.parsetrace.core.config;

import lombok.Getter;
import lombok.Setter;

/**
 * 单个通道的覆盖设置，未填写的字段沿用会话默认值
 */
@Getter
@Setter
public class TagSettings {
    private Boolean active;
    private Boolean printImmediate;
    private Integer maxDepth;
}
