package com.llmbridge.gateway.dto.canonical;

/**
 * 工具选择策略
 *
 * @param mode     模式
 * @param toolName 仅 {@link Mode#TOOL} 时有值
 */
public record ToolChoice(Mode mode, String toolName) {

    public static final ToolChoice AUTO = new ToolChoice(Mode.AUTO, null);

    public enum Mode {
        AUTO,
        NONE,
        /** 必须调用任一工具 */
        ANY,
        /** 必须调用指定工具 */
        TOOL
    }

    public static ToolChoice of(Mode mode) {
        return new ToolChoice(mode, null);
    }

    public static ToolChoice tool(String name) {
        return new ToolChoice(Mode.TOOL, name);
    }

    public boolean isForced() {
        return mode == Mode.ANY || mode == Mode.TOOL;
    }
}
