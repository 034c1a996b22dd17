package com.qubi.hookhub.core.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.qubi.hookhub.core.model.JsonSupport;
import com.qubi.hookhub.core.model.SchemaRef;
import com.qubi.hookhub.core.validation.FailureKind;
import com.qubi.hookhub.core.validation.Outcome;
import org.junit.jupiter.api.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParameterCoercionFormatterTest {

    private static final SchemaRef SCHEMA = new SchemaRef("com.callrail", "call_complete", "jsonschema", "1-0-2");
    private static final FieldTypePlan PLAN = new FieldTypePlan(
            List.of("first_call", "answered"),
            List.of("duration"),
            new FieldTypePlan.DateTimeFields(List.of("datetime"), "yyyy-MM-dd HH:mm:ss"));

    private ParameterCoercionFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new ParameterCoercionFormatter(PLAN, SCHEMA, "com.callrail-v1", CoercionPolicy.DROP);
    }

    @Test
    void coercesDeclaredFields() {
        var out = formatter.coerce(map("first_call", "true", "duration", "42", "datetime", "2019-01-02 03:04:05"));

        assertTrue(out.isValid());
        assertEquals(Map.of("first_call", "1", "duration", "42", "datetime", "2019-01-02T03:04:05.000Z"), out.value());
    }

    @Test
    void lenientBooleans() {
        var out = formatter.coerce(map("first_call", "YES", "answered", "off"));

        assertEquals(Map.of("first_call", "1", "answered", "0"), out.value());
    }

    @Test
    void undeclaredFieldsPassUnchanged() {
        var out = formatter.coerce(map("callsource", "google_paid", "answered", "false", "note", ""));

        assertEquals(Map.of("callsource", "google_paid", "answered", "0", "note", ""), out.value());
    }

    @Test
    void unparseableDeclaredFieldsAreDroppedByDefault() {
        var out = formatter.coerce(map(
                "first_call", "maybe",
                "duration", "4 min",
                "datetime", "yesterday",
                "answered", "",
                "caller", "Jane"));

        assertTrue(out.isValid(), "DROP nunca falla el request");
        assertEquals(Map.of("caller", "Jane"), out.value());
    }

    @Test
    void rejectPolicyAccumulatesEveryCoercionFailure() {
        var strict = new ParameterCoercionFormatter(PLAN, SCHEMA, "com.callrail-v1", CoercionPolicy.REJECT);

        var out = strict.coerce(map("first_call", "maybe", "duration", "4 min", "answered", "true"));

        assertFalse(out.isValid());
        assertEquals(2, out.failures().size());
        assertTrue(out.failures().stream().allMatch(f -> f.kind() == FailureKind.COERCION_FAILURE));
        assertEquals("Value [maybe] for key first_call is not a valid boolean", out.messages().get(0));
        assertEquals("Value [4 min] for key duration is not a valid integer", out.messages().get(1));
    }

    @Test
    void coercionIsIdempotent() {
        Map<String, String> once = formatter.coerce(
                map("first_call", "true", "answered", "0", "duration", "-7", "datetime", "2019-01-02 03:04:05")).value();

        assertEquals(once, formatter.coerce(once).value());
    }

    @Test
    void isoInstantsAreCanonicalised() {
        var out = formatter.coerce(map("datetime", "2019-01-02T03:04:05Z"));

        assertEquals("2019-01-02T03:04:05.000Z", out.value().get("datetime"));
    }

    @Test
    void impossibleDatesAreNotShiftedToAnotherDay() {
        var out = formatter.coerce(map("datetime", "2019-02-30 10:00:00", "caller", "Jane"));

        assertTrue(out.isValid());
        assertEquals(Map.of("caller", "Jane"), out.value(), "30 de febrero no existe: se omite");
    }

    @Test
    void impossibleDatesAreReportedUnderReject() {
        var strict = new ParameterCoercionFormatter(PLAN, SCHEMA, "com.callrail-v1", CoercionPolicy.REJECT);

        var out = strict.coerce(map("datetime", "2019-02-30 10:00:00"));

        assertFalse(out.isValid());
        assertEquals(FailureKind.COERCION_FAILURE, out.failures().head().kind());
    }

    @Test
    void leapDayStillParses() {
        var out = formatter.coerce(map("datetime", "2020-02-29 23:59:59"));

        assertEquals("2020-02-29T23:59:59.000Z", out.value().get("datetime"));
    }

    @Test
    void dateOnlyPatternMeansMidnightUtc() {
        var plan = new FieldTypePlan(List.of(), List.of(),
                new FieldTypePlan.DateTimeFields(List.of("d"), "yyyy-MM-dd"));
        var strict = new ParameterCoercionFormatter(plan, SCHEMA, "com.callrail-v1", CoercionPolicy.REJECT);

        var out = strict.coerce(map("d", "2019-01-02"));

        assertTrue(out.isValid(), () -> "falló: " + out);
        assertEquals("2019-01-02T00:00:00.000Z", out.value().get("d"));
        assertEquals(out.value(), strict.coerce(out.value()).value(), "idempotente también sin hora");
        assertFalse(strict.coerce(map("d", "2019-02-30")).isValid());
    }

    @Test
    void surroundingWhitespaceIsIgnoredByEveryConverter() {
        var out = formatter.coerce(map("duration", " 42 ", "first_call", " true", "datetime", " 2019-01-02 03:04:05 "));

        assertEquals(Map.of("duration", "42", "first_call", "1", "datetime", "2019-01-02T03:04:05.000Z"), out.value());
    }

    @Test
    void formatWrapsFieldsAsStructuredEvent() throws Exception {
        Map<String, String> raw = map(
                "first_call", "true", "duration", "42", "datetime", "2019-01-02 03:04:05",
                "answered", "nope", "tag", "", "aid", "my-app", "nuid", "abc");

        Outcome<Map<String, String>> out = formatter.format(raw, "srv");

        assertTrue(out.isValid());
        Map<String, String> params = out.value();
        assertEquals("com.callrail-v1", params.get("tv"));
        assertEquals("ue", params.get("e"));
        assertEquals("srv", params.get("p"));
        assertEquals("my-app", params.get("aid"));
        assertEquals("abc", params.get("nuid"));

        JsonNode ue = JsonSupport.MAPPER.readTree(params.get("ue_pr"));
        assertEquals(ParameterCoercionFormatter.UNSTRUCT_EVENT_SCHEMA, ue.get("schema").asText());
        assertEquals("iglu:com.callrail/call_complete/jsonschema/1-0-2", ue.at("/data/schema").asText());
        JsonNode data = ue.at("/data/data");
        assertTrue(data.get("first_call").isBoolean());
        assertTrue(data.get("first_call").booleanValue());
        assertTrue(data.get("duration").isIntegralNumber());
        assertEquals(42, data.get("duration").intValue());
        assertEquals("2019-01-02T03:04:05.000Z", data.get("datetime").asText());
        assertTrue(data.get("tag").isNull(), "cadena vacía => null");
        assertFalse(data.has("answered"), "valor inválido se omite");
        assertFalse(data.has("aid"), "los passthrough no van embebidos");
    }

    @Test
    void rawPlatformWinsOverDefault() {
        var out = formatter.format(map("p", "web", "duration", "1"), "srv");

        assertEquals("web", out.value().get("p"));
    }

    @Test
    void planRejectsOverlappingFieldLists() {
        assertThrows(IllegalArgumentException.class,
                () -> new FieldTypePlan(List.of("x"), List.of("x"), null));
        assertThrows(IllegalArgumentException.class,
                () -> new FieldTypePlan(List.of(), List.of("d"),
                        new FieldTypePlan.DateTimeFields(List.of("d"), "yyyy-MM-dd HH:mm:ss")));
    }

    @Test
    void planCollapsesKeysRepeatedInOneList() {
        var plan = new FieldTypePlan(List.of("a", "a", "b"), List.of("n", "n"),
                new FieldTypePlan.DateTimeFields(List.of("d", "d"), "yyyy-MM-dd"));

        assertEquals(List.of("a", "b"), plan.booleans());
        assertEquals(List.of("n"), plan.integers());
        assertEquals(List.of("d"), plan.dateTimes().fields());
    }

    @Test
    void planRejectsBadPattern() {
        assertThrows(IllegalArgumentException.class,
                () -> new FieldTypePlan.DateTimeFields(List.of("d"), "yyyy-MM-dd {{"));
    }

    private static Map<String, String> map(String... kv) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put(kv[i], kv[i + 1]);
        return m;
    }
}
