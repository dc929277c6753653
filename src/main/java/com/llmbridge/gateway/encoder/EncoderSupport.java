package com.llmbridge.gateway.encoder;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 响应编码共用方法
 */
final class EncoderSupport {

    private static final Logger log = LoggerFactory.getLogger(EncoderSupport.class);

    private EncoderSupport() {
    }

    /**
     * 累积的工具参数文本 → JSON 对象，非法时保留原文
     */
    static JSONObject parseArguments(String argumentsJsonText) {
        if (argumentsJsonText == null || argumentsJsonText.isBlank()) {
            return new JSONObject();
        }
        try {
            JSONObject parsed = JSONObject.parseObject(argumentsJsonText);
            return parsed != null ? parsed : new JSONObject();
        } catch (JSONException e) {
            log.warn("工具参数不是合法 JSON，以 raw 字段返回: {}", argumentsJsonText);
            return JSONObject.of("raw", argumentsJsonText);
        }
    }
}
