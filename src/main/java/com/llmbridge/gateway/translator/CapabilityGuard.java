package com.llmbridge.gateway.translator;

import com.llmbridge.gateway.config.BackendCapabilities;
import com.llmbridge.gateway.config.BackendConfig;
import com.llmbridge.gateway.dto.canonical.CanonicalRequest;
import com.llmbridge.gateway.dto.canonical.ToolChoice;
import com.llmbridge.gateway.dto.canonical.ToolDefinition;
import com.llmbridge.gateway.exception.UnsupportedCapabilityException;
import com.llmbridge.gateway.schema.SchemaSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 按后端能力描述检查并改写请求
 * <p>
 * 能力缺失直接拒绝；开启推理时不被允许的工具选择模式改写为 AUTO；工具 schema 清洗为后端方言
 */
@Component
public class CapabilityGuard {

    private static final Logger log = LoggerFactory.getLogger(CapabilityGuard.class);

    private final SchemaSanitizer sanitizer;

    public CapabilityGuard(SchemaSanitizer sanitizer) {
        this.sanitizer = sanitizer;
    }

    public Prepared prepare(CanonicalRequest request, BackendConfig backend) {
        BackendCapabilities caps = backend.capabilities();
        boolean reasoning = request.reasoning().enabled();

        if (reasoning && !caps.supportsReasoning()) {
            throw new UnsupportedCapabilityException(backend.name(), "reasoning");
        }
        if (request.hasTools() && !caps.supportsTools()) {
            throw new UnsupportedCapabilityException(backend.name(), "tools");
        }

        ToolChoice choice = request.toolChoice();
        if (choice != null && !caps.toolChoiceModes().contains(choice.mode())) {
            throw new UnsupportedCapabilityException(backend.name(), "tool_choice=" + choice.mode().name().toLowerCase());
        }
        if (choice != null && reasoning && !caps.reasoningToolChoiceModes().contains(choice.mode())) {
            log.warn("后端 {} 开启推理时不允许 tool_choice={}，改写为 auto", backend.name(), choice.mode().name().toLowerCase());
            choice = ToolChoice.AUTO;
        }

        List<ToolDefinition> tools = sanitizer.sanitize(request.tools(), caps);
        return new Prepared(request, tools, choice);
    }

    /**
     * 检查后的请求，tools / toolChoice 以此处为准
     */
    public record Prepared(CanonicalRequest request, List<ToolDefinition> tools, ToolChoice toolChoice) {

        public boolean reasoning() {
            return request.reasoning().enabled();
        }
    }
}
