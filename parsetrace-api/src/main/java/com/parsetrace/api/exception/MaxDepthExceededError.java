package com.parsetrace.api.exception;

/**
 * 嵌套深度超限
 * 在配置了 maxDepth 的通道上，open 时当前层级已达到上限。通常意味着无限递归。
 */
public class MaxDepthExceededError extends TraceAbortError {

    private final int maxDepth;

    public MaxDepthExceededError(String tag, int maxDepth) {
        super(tag, "Max level reached: " + maxDepth + " (tag '" + tag + "')");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
