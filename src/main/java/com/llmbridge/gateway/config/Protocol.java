package com.llmbridge.gateway.config;

import com.llmbridge.gateway.exception.InvalidRequestException;

/**
 * 支持的线协议
 */
public enum Protocol {
    ANTHROPIC("anthropic"),
    OPENAI("openai"),
    GEMINI("gemini");

    private final String value;

    Protocol(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Protocol fromValue(String value) {
        if (value != null) {
            for (Protocol p : values()) {
                if (p.value.equalsIgnoreCase(value.trim()) || p.name().equalsIgnoreCase(value.trim())) {
                    return p;
                }
            }
        }
        throw new InvalidRequestException("未知协议: " + value);
    }
}
