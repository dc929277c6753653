package com.llmbridge.gateway.dto.canonical;

/**
 * 消息角色
 */
public enum Role {
    SYSTEM,
    USER,
    ASSISTANT,
    TOOL
}
