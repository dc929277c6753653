package com.llmbridge.gateway.translator;

import com.llmbridge.gateway.config.BackendConfig;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.dto.canonical.CanonicalRequest;
import com.llmbridge.gateway.exception.UnsupportedCapabilityException;

/**
 * 后端请求编码：规范化请求 → 后端 URL + 请求头 + 请求体
 * <p>
 * 后端调用一律使用流式接口，非流式客户端由网关聚合
 */
public interface RequestEncoder {

    Protocol protocol();

    /**
     * @throws UnsupportedCapabilityException 请求需要后端不具备的能力
     */
    WireRequest encode(CanonicalRequest request, BackendConfig backend);
}
