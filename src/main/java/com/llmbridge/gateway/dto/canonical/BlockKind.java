package com.llmbridge.gateway.dto.canonical;

/**
 * 内容块类型
 */
public enum BlockKind {
    TEXT,
    THINKING,
    TOOL_USE
}
