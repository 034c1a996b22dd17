package com.qubi.hookhub.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.qubi.hookhub.core.validation.Failure;
import com.qubi.hookhub.core.validation.FailureKind;
import com.qubi.hookhub.core.validation.Outcome;

public final class JsonSupport {
    private JsonSupport(){}
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .disable(SerializationFeature.INDENT_OUTPUT);
    public static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /** JSON compacto, ej. para embeber en un parámetro. */
    public static String toJson(JsonNode node){
        try { return MAPPER.writeValueAsString(node); }
        catch (JsonProcessingException e){ throw new IllegalStateException(e); }
    }

    /** Parsea {@code text}; un JSON mal formado es un BODY_PARSE_ERROR, no una excepción. */
    public static Outcome<JsonNode> parse(String field, String text){
        try {
            JsonNode node = MAPPER.readTree(text);
            if (node == null || node.isMissingNode())
                return Outcome.invalid(Failure.of(FailureKind.BODY_PARSE_ERROR,
                        "%s: invalid JSON [%s] with parsing error: no content", field, text));
            return Outcome.valid(node);
        } catch (JsonProcessingException e){
            return Outcome.invalid(Failure.of(FailureKind.BODY_PARSE_ERROR,
                    "%s: invalid JSON [%s] with parsing error: %s", field, text, e.getOriginalMessage()));
        }
    }
}
