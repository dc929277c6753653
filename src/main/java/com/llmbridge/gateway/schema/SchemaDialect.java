package com.llmbridge.gateway.schema;

import java.util.Set;

/**
 * 后端接受的 JSON Schema 子集
 * <p>
 * vocabulary 为 null 表示接受全部关键字；advisory 为不约束取值的元数据，可直接删除；
 * relaxed 为后端拒收且没有等价写法的关键字，删除并告警
 */
public enum SchemaDialect {

    /** 完整 JSON Schema */
    ANTHROPIC(null, Set.of(), Set.of(), true, false, null),

    OPENAI(null, Set.of("$schema"), Set.of(), false, false, null),

    /** OpenAI 兼容中转，仅接受最小子集 */
    OPENAI_COMPAT(
            Set.of("type", "properties", "required", "enum", "description", "items", "anyOf", "nullable"),
            Set.of("$schema", "$id", "$comment", "title", "examples", "default", "deprecated", "readOnly", "writeOnly", "format"),
            Set.of("additionalProperties"),
            false, false, null),

    /** Gemini OpenAPI 3.0 子集 */
    GEMINI(
            Set.of("type", "format", "title", "description", "nullable", "enum", "properties", "required", "items",
                    "minItems", "maxItems", "minimum", "maximum", "minLength", "maxLength", "pattern",
                    "anyOf", "propertyOrdering", "minProperties", "maxProperties"),
            Set.of("$schema", "$id", "$comment", "examples", "default", "deprecated", "readOnly", "writeOnly"),
            Set.of("additionalProperties"),
            false, true, Set.of("enum", "date-time"));

    private final Set<String> vocabulary;
    private final Set<String> advisory;
    private final Set<String> relaxed;
    private final boolean supportsConst;
    private final boolean nullableTypeArrays;
    private final Set<String> stringFormats;

    SchemaDialect(Set<String> vocabulary, Set<String> advisory, Set<String> relaxed,
                  boolean supportsConst, boolean nullableTypeArrays, Set<String> stringFormats) {
        this.vocabulary = vocabulary;
        this.advisory = advisory;
        this.relaxed = relaxed;
        this.supportsConst = supportsConst;
        this.nullableTypeArrays = nullableTypeArrays;
        this.stringFormats = stringFormats;
    }

    public boolean supports(String keyword) {
        return vocabulary == null || vocabulary.contains(keyword);
    }

    public boolean isAdvisory(String keyword) {
        return advisory.contains(keyword);
    }

    public boolean isRelaxed(String keyword) {
        return relaxed.contains(keyword);
    }

    public boolean supportsConst() {
        return supportsConst;
    }

    /**
     * type: ["x", "null"] 是否改写为 type: "x" + nullable: true
     */
    public boolean nullableTypeArrays() {
        return nullableTypeArrays;
    }

    /**
     * 字符串 format 仅为注解，不在白名单内时删除；null 表示不限制
     */
    public boolean acceptsFormat(String format) {
        return stringFormats == null || stringFormats.contains(format);
    }
}
