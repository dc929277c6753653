package com.llmbridge.gateway.exception;

/**
 * 请求的能力目标后端无法提供，编码阶段拒绝
 */
public class UnsupportedCapabilityException extends GatewayException {

    public UnsupportedCapabilityException(String backend, String capability) {
        super("后端 " + backend + " 不支持: " + capability, 400);
    }

    @Override
    public String errorType() {
        return "invalid_request_error";
    }
}
