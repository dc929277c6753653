package com.llmbridge.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class BridgeGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(BridgeGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(BridgeGatewayApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("╔═══════════════════════════════════════════════════╗");
        log.info("║            LLM Bridge Gateway v1.0.0              ║");
        log.info("║    Anthropic / OpenAI / Gemini Protocol Bridge    ║");
        log.info("╚═══════════════════════════════════════════════════╝");
        log.info("API 端点:");
        log.info("  POST /v1/messages                                   (Anthropic)");
        log.info("  POST /v1/chat/completions                           (OpenAI)");
        log.info("  POST /v1beta/models/{model}:streamGenerateContent   (Gemini)");
        log.info("  POST /v1beta/models/{model}:generateContent         (Gemini)");
        log.info("  GET  /v1/models");
        log.info("  GET  /health");
        log.info("  GET  /metrics");
    }
}
