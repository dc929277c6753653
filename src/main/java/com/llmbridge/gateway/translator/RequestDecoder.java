package com.llmbridge.gateway.translator;

import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.dto.canonical.CanonicalRequest;
import com.llmbridge.gateway.exception.InvalidRequestException;

/**
 * 客户端请求解码：线格式 → 规范化请求
 */
public interface RequestDecoder {

    Protocol protocol();

    /**
     * @param request 客户端原始请求体
     * @throws InvalidRequestException 请求格式错误
     */
    CanonicalRequest decode(JSONObject request);
}
