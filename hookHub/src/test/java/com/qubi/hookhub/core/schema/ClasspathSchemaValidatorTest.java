package com.qubi.hookhub.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.qubi.hookhub.core.model.JsonSupport;
import com.qubi.hookhub.core.model.SchemaRef;
import com.qubi.hookhub.core.validation.FailureKind;
import com.qubi.hookhub.core.validation.Outcome;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class ClasspathSchemaValidatorTest {

    private static final SchemaRef PAYLOAD_DATA =
            SchemaRef.parse("iglu:com.snowplowanalytics.snowplow/payload_data/jsonschema/1-0-4");
    private static final SchemaRef ACME = SchemaRef.parse("iglu:com.acme/events/jsonschema/1-0-0");

    private ClasspathSchemaValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ClasspathSchemaValidator();
    }

    @Test
    void plainDocumentIsReturnedAsIs() {
        JsonNode doc = json("[{\"a\":\"1\"},{\"a\":\"2\"}]");

        Outcome<JsonNode> out = validator.validate(doc, ACME);

        assertTrue(out.isValid(), () -> "falló: " + out);
        assertSame(doc, out.value());
    }

    @Test
    void selfDescribingDocumentIsUnwrapped() {
        JsonNode doc = json("{\"schema\":\"iglu:com.snowplowanalytics.snowplow/payload_data/jsonschema/1-0-4\","
                + "\"data\":[{\"e\":\"pv\",\"p\":\"web\",\"tv\":\"js-2.10.0\",\"url\":\"https://acme.com\"}]}");

        Outcome<JsonNode> out = validator.validate(doc, PAYLOAD_DATA);

        assertTrue(out.isValid(), () -> "falló: " + out);
        assertTrue(out.value().isArray());
        assertEquals("pv", out.value().get(0).get("e").asText());
    }

    @Test
    void incompatibleDeclaredSchemaIsRejected() {
        JsonNode doc = json("{\"schema\":\"iglu:com.acme/events/jsonschema/1-0-0\",\"data\":[]}");

        Outcome<JsonNode> out = validator.validate(doc, PAYLOAD_DATA);

        assertFalse(out.isValid());
        assertEquals(FailureKind.SCHEMA_VIOLATION, out.failures().head().kind());
        assertTrue(out.messages().head().startsWith("Verifying schema as iglu:com.snowplowanalytics.snowplow/payload_data"));
    }

    @Test
    void nonConformingDocumentReportsEveryViolation() {
        JsonNode doc = json("[{\"e\":\"pv\",\"p\":\"web\",\"tv\":\"js\",\"n\":1},{\"e\":\"pv\"}]");

        Outcome<JsonNode> out = validator.validate(doc, PAYLOAD_DATA);

        assertFalse(out.isValid());
        assertTrue(out.failures().size() >= 2, () -> "violaciones: " + out.messages());
        assertTrue(out.failures().stream().allMatch(f -> f.kind() == FailureKind.SCHEMA_VIOLATION));
    }

    @Test
    void emptyBatchViolatesPayloadData() {
        assertFalse(validator.validate(json("[]"), PAYLOAD_DATA).isValid());
    }

    @Test
    void missingSchemaIsAFailureNotAnException() {
        Outcome<JsonNode> out = validator.validate(json("[]"), SchemaRef.parse("iglu:com.acme/nope/jsonschema/1-0-0"));

        assertFalse(out.isValid());
        assertEquals("Could not find schema iglu:com.acme/nope/jsonschema/1-0-0", out.messages().head());
    }

    @Test
    void unreadableSchemaIsAFailureNotAnException() {
        Outcome<JsonNode> out = validator.validate(json("[]"), SchemaRef.parse("iglu:com.acme/broken/jsonschema/1-0-0"));

        assertFalse(out.isValid());
        assertTrue(out.messages().head().startsWith("Could not load schema iglu:com.acme/broken/jsonschema/1-0-0"));
    }

    private static JsonNode json(String s) {
        return JsonSupport.parse("test", s).value();
    }
}
