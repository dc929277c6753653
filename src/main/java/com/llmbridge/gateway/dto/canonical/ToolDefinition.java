package com.llmbridge.gateway.dto.canonical;

import com.alibaba.fastjson2.JSONObject;

/**
 * 工具定义，parametersSchema 为 JSON Schema 树
 */
public record ToolDefinition(String name, String description, JSONObject parametersSchema) {

    public ToolDefinition withSchema(JSONObject schema) {
        return new ToolDefinition(name, description, schema);
    }
}
