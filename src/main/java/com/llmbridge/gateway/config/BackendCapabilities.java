package com.llmbridge.gateway.config;

import com.llmbridge.gateway.dto.canonical.ToolChoice;
import com.llmbridge.gateway.schema.SchemaDialect;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 后端能力描述，请求编码器据此决定改写或拒绝
 *
 * @param supportsReasoning         是否支持推理过程输出
 * @param supportsTools             是否支持工具调用
 * @param toolChoiceModes           支持的工具选择模式
 * @param reasoningToolChoiceModes  开启推理时允许的工具选择模式，其余改写为 AUTO
 * @param schemaDialect             工具 schema 方言
 * @param systemInstruction         是否有独立的系统提示字段，否则并入首个用户轮次
 * @param inlineThinkingTags        推理内容以 &lt;think&gt; 标签内嵌在正文中
 */
public record BackendCapabilities(
        boolean supportsReasoning,
        boolean supportsTools,
        Set<ToolChoice.Mode> toolChoiceModes,
        Set<ToolChoice.Mode> reasoningToolChoiceModes,
        SchemaDialect schemaDialect,
        boolean systemInstruction,
        boolean inlineThinkingTags
) {

    public static BackendCapabilities defaults(Protocol protocol) {
        Set<ToolChoice.Mode> all = EnumSet.allOf(ToolChoice.Mode.class);
        return switch (protocol) {
            // Anthropic 开启 thinking 时禁止强制工具调用
            case ANTHROPIC -> new BackendCapabilities(true, true, all,
                    EnumSet.of(ToolChoice.Mode.AUTO, ToolChoice.Mode.NONE), SchemaDialect.ANTHROPIC, true, false);
            case OPENAI -> new BackendCapabilities(true, true, all, all, SchemaDialect.OPENAI, true, false);
            case GEMINI -> new BackendCapabilities(true, true, all, all, SchemaDialect.GEMINI, true, false);
        };
    }

    /**
     * 以配置覆盖协议默认值
     */
    public static BackendCapabilities from(Protocol protocol, AppProperties.CapabilityProperties props) {
        BackendCapabilities base = defaults(protocol);
        if (props == null) {
            return base;
        }
        return new BackendCapabilities(
                props.getSupportsReasoning() != null ? props.getSupportsReasoning() : base.supportsReasoning,
                props.getSupportsTools() != null ? props.getSupportsTools() : base.supportsTools,
                props.getToolChoiceModes() != null ? parseModes(props.getToolChoiceModes()) : base.toolChoiceModes,
                props.getReasoningToolChoiceModes() != null ? parseModes(props.getReasoningToolChoiceModes()) : base.reasoningToolChoiceModes,
                props.getSchemaDialect() != null ? SchemaDialect.valueOf(props.getSchemaDialect().toUpperCase()) : base.schemaDialect,
                props.getSystemInstruction() != null ? props.getSystemInstruction() : base.systemInstruction,
                props.getInlineThinkingTags() != null ? props.getInlineThinkingTags() : base.inlineThinkingTags);
    }

    private static Set<ToolChoice.Mode> parseModes(List<String> modes) {
        Set<ToolChoice.Mode> result = EnumSet.noneOf(ToolChoice.Mode.class);
        for (String mode : modes) {
            result.add(ToolChoice.Mode.valueOf(mode.trim().toUpperCase()));
        }
        return result;
    }
}
