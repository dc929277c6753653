package com.llmbridge.gateway.dto.canonical;

/**
 * Token 用量
 */
public record Usage(int inputTokens, int outputTokens) {

    public static final Usage EMPTY = new Usage(0, 0);

    /**
     * 合并后到的用量，非零字段覆盖
     */
    public Usage merge(Usage other) {
        if (other == null) {
            return this;
        }
        return new Usage(
                other.inputTokens > 0 ? other.inputTokens : inputTokens,
                other.outputTokens > 0 ? other.outputTokens : outputTokens);
    }

    public int totalTokens() {
        return inputTokens + outputTokens;
    }
}
