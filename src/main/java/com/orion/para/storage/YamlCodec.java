package com.orion.para.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Structured-text codec for entity and index files.
 *
 * String scalars are always written double-quoted so values such as
 * {@code .inf}, {@code 0x1F} or {@code 1_000} read back as strings.
 */
public final class YamlCodec {

    private final ObjectMapper mapper;

    public YamlCodec() {
        this.mapper = new ObjectMapper(
            new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .disable(YAMLGenerator.Feature.SPLIT_LINES)
                .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR))
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    /**
     * Parse YAML text into a tree. Empty documents parse to a null node.
     */
    public JsonNode parse(String text) throws JsonProcessingException {
        if (text == null || text.isBlank()) {
            return NullNode.getInstance();
        }
        JsonNode node = mapper.readTree(text);
        if (node == null || node instanceof MissingNode) {
            return NullNode.getInstance();
        }
        return node;
    }

    public String stringify(Object value) throws JsonProcessingException {
        return mapper.writeValueAsString(value);
    }

    public JsonNode toTree(Object value) {
        return mapper.valueToTree(value);
    }

    public <T> T convert(JsonNode node, Class<T> type) throws JsonProcessingException {
        return mapper.treeToValue(node, type);
    }
}
