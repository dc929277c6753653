package com.llmbridge.gateway.dto.canonical;

/**
 * 推理（thinking）开关
 *
 * @param enabled      是否请求推理过程
 * @param budgetTokens 推理 token 预算，可为 null
 * @param effort       low / medium / high，可为 null
 */
public record ReasoningConfig(boolean enabled, Integer budgetTokens, String effort) {

    public static final ReasoningConfig DISABLED = new ReasoningConfig(false, null, null);

    public static ReasoningConfig budget(int budgetTokens) {
        return new ReasoningConfig(true, budgetTokens, null);
    }

    public static ReasoningConfig effort(String effort) {
        return new ReasoningConfig(true, null, effort);
    }

    /**
     * 统一折算为 token 预算
     */
    public int resolveBudget(int fallback) {
        if (budgetTokens != null && budgetTokens > 0) {
            return budgetTokens;
        }
        if (effort == null) {
            return fallback;
        }
        return switch (effort.toLowerCase()) {
            case "minimal", "low" -> 2048;
            case "medium" -> 8192;
            case "high" -> 24576;
            default -> fallback;
        };
    }

    /**
     * 统一折算为 effort 等级
     */
    public String resolveEffort() {
        if (effort != null && !effort.isEmpty()) {
            return effort;
        }
        if (budgetTokens == null) {
            return "medium";
        }
        if (budgetTokens <= 2048) {
            return "low";
        }
        return budgetTokens <= 16384 ? "medium" : "high";
    }
}
