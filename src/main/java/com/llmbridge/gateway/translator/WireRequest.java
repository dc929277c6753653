package com.llmbridge.gateway.translator;

import com.alibaba.fastjson2.JSONObject;

import java.util.Map;

/**
 * 发往后端的请求
 */
public record WireRequest(String url, Map<String, String> headers, JSONObject body) {

    public WireRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public String bodyText() {
        return body.toJSONString();
    }
}
