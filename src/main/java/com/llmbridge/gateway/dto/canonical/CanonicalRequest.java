package com.llmbridge.gateway.dto.canonical;

import java.util.List;

/**
 * 规范化请求，所有协议间转换的中间形态
 */
public record CanonicalRequest(
        String model,
        List<CanonicalMessage> messages,
        List<ToolDefinition> tools,
        ToolChoice toolChoice,
        ReasoningConfig reasoning,
        Integer maxTokens,
        Double temperature,
        Double topP,
        List<String> stopSequences,
        boolean stream
) {

    public CanonicalRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
        stopSequences = stopSequences == null ? List.of() : List.copyOf(stopSequences);
        reasoning = reasoning == null ? ReasoningConfig.DISABLED : reasoning;
    }

    public CanonicalRequest withModel(String newModel) {
        return new CanonicalRequest(newModel, messages, tools, toolChoice, reasoning,
                maxTokens, temperature, topP, stopSequences, stream);
    }

    public CanonicalRequest withReasoning(ReasoningConfig newReasoning) {
        return new CanonicalRequest(model, messages, tools, toolChoice, newReasoning,
                maxTokens, temperature, topP, stopSequences, stream);
    }

    public CanonicalRequest withStream(boolean newStream) {
        return new CanonicalRequest(model, messages, tools, toolChoice, reasoning,
                maxTokens, temperature, topP, stopSequences, newStream);
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }
}
