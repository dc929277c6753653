package com.llmbridge.gateway.schema;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.config.BackendCapabilities;
import com.llmbridge.gateway.dto.canonical.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 工具参数 Schema 清洗器
 * <p>
 * 递归遍历 schema 树，把目标后端不支持的关键字改写为等价写法（const → 单元素 enum），
 * 删除纯注解性元数据；缩小取值范围且无等价写法的关键字原样保留，交给后端校验。
 * 输入不会被修改，结果满足 sanitize(sanitize(x)) == sanitize(x)
 */
@Component
public class SchemaSanitizer {

    private static final Logger log = LoggerFactory.getLogger(SchemaSanitizer.class);

    // 值为 schema 映射（键是属性名而非关键字）
    private static final Set<String> SCHEMA_MAP_KEYWORDS = Set.of("properties", "patternProperties", "$defs", "definitions");
    // 值为单个 schema
    private static final Set<String> SCHEMA_KEYWORDS = Set.of("items", "additionalProperties", "not", "contains", "if", "then", "else");
    // 值为 schema 数组
    private static final Set<String> SCHEMA_ARRAY_KEYWORDS = Set.of("anyOf", "allOf", "oneOf", "prefixItems", "items");

    public List<ToolDefinition> sanitize(List<ToolDefinition> tools, BackendCapabilities capabilities) {
        return sanitize(tools, capabilities.schemaDialect());
    }

    public List<ToolDefinition> sanitize(List<ToolDefinition> tools, SchemaDialect dialect) {
        List<ToolDefinition> result = new ArrayList<>(tools.size());
        for (ToolDefinition tool : tools) {
            result.add(tool.withSchema(sanitizeSchema(tool.parametersSchema(), dialect, tool.name())));
        }
        return result;
    }

    public JSONObject sanitizeSchema(JSONObject schema, SchemaDialect dialect) {
        return sanitizeSchema(schema, dialect, "schema");
    }

    private JSONObject sanitizeSchema(JSONObject schema, SchemaDialect dialect, String path) {
        if (schema == null) {
            return null;
        }
        return sanitizeNode(schema, dialect, path);
    }

    private JSONObject sanitizeNode(JSONObject node, SchemaDialect dialect, String path) {
        JSONObject out = new JSONObject();
        for (Map.Entry<String, Object> entry : node.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();

            if ("const".equals(key) && !dialect.supportsConst()) {
                rewriteConst(node, out, value, path);
                continue;
            }
            if ("enum".equals(key) && out.containsKey("enum")) {
                // const 已改写出 enum
                continue;
            }
            if ("type".equals(key) && value instanceof JSONArray types && dialect.nullableTypeArrays()) {
                rewriteTypeArray(out, types);
                continue;
            }
            if ("format".equals(key) && value instanceof String format && !dialect.acceptsFormat(format)) {
                log.debug("删除不支持的 format: {} ({})", format, path);
                continue;
            }
            if (!dialect.supports(key)) {
                if (dialect.isAdvisory(key)) {
                    continue;
                }
                if (dialect.isRelaxed(key)) {
                    log.warn("后端 schema 方言 {} 不接受 {}，已删除 ({})", dialect, key, path);
                    continue;
                }
                log.debug("后端 schema 方言 {} 未声明支持 {}，保留 ({})", dialect, key, path);
            }
            out.put(key, sanitizeValue(key, value, dialect, path));
        }
        return out;
    }

    private Object sanitizeValue(String key, Object value, SchemaDialect dialect, String path) {
        if (SCHEMA_MAP_KEYWORDS.contains(key) && value instanceof JSONObject map) {
            JSONObject out = new JSONObject();
            for (Map.Entry<String, Object> child : map.entrySet()) {
                out.put(child.getKey(), child.getValue() instanceof JSONObject schema
                        ? sanitizeNode(schema, dialect, path + "." + child.getKey())
                        : copy(child.getValue()));
            }
            return out;
        }
        if (SCHEMA_KEYWORDS.contains(key) && value instanceof JSONObject schema) {
            return sanitizeNode(schema, dialect, path + "." + key);
        }
        if (SCHEMA_ARRAY_KEYWORDS.contains(key) && value instanceof JSONArray array) {
            JSONArray out = new JSONArray(array.size());
            for (int i = 0; i < array.size(); i++) {
                Object item = array.get(i);
                out.add(item instanceof JSONObject schema
                        ? sanitizeNode(schema, dialect, path + "." + key + "[" + i + "]")
                        : copy(item));
            }
            return out;
        }
        return copy(value);
    }

    /**
     * const: v 与 enum 取交集：enum 缺失或包含 v 时得到 enum: [v]；否则无等价写法，保留 const
     */
    private void rewriteConst(JSONObject node, JSONObject out, Object constValue, String path) {
        Object existing = node.get("enum");
        if (existing instanceof JSONArray values && !values.contains(constValue)) {
            log.debug("const 与 enum 冲突，保留 const ({})", path);
            out.put("const", copy(constValue));
            return;
        }
        out.put("enum", JSONArray.of(copy(constValue)));
    }

    private void rewriteTypeArray(JSONObject out, JSONArray types) {
        List<Object> nonNull = new ArrayList<>();
        for (Object type : types) {
            if (!"null".equals(type)) {
                nonNull.add(type);
            }
        }
        if (nonNull.size() == 1 && nonNull.size() < types.size()) {
            out.put("type", nonNull.get(0));
            out.put("nullable", true);
            return;
        }
        out.put("type", copy(types));
    }

    private static Object copy(Object value) {
        if (value instanceof JSONObject obj) {
            JSONObject out = new JSONObject();
            obj.forEach((k, v) -> out.put(k, copy(v)));
            return out;
        }
        if (value instanceof JSONArray arr) {
            JSONArray out = new JSONArray(arr.size());
            for (Object item : arr) {
                out.add(copy(item));
            }
            return out;
        }
        return value;
    }
}
