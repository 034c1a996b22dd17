package com.qubi.hookhub.core.format;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qubi.hookhub.core.model.JsonSupport;
import com.qubi.hookhub.core.model.NonEmptyList;
import com.qubi.hookhub.core.model.SchemaRef;
import com.qubi.hookhub.core.validation.Accumulator;
import com.qubi.hookhub.core.validation.Failure;
import com.qubi.hookhub.core.validation.FailureKind;
import com.qubi.hookhub.core.validation.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Convierte los parámetros crudos (todos strings) de un webhook a valores
 * tipados según un {@link FieldTypePlan}, y los empaqueta como un evento
 * estructurado self-describing:
 *
 * <pre>
 * tv    = tag del tracker (ej. "com.callrail-v1")
 * e     = "ue"
 * p     = plataforma ("p" crudo si vino, si no el default)
 * ue_pr = {"schema":"iglu:.../unstruct_event/...","data":{"schema":&lt;schema&gt;,"data":{...}}}
 * </pre>
 *
 * Los campos no declarados en el plan pasan sin cambios.
 */
public final class ParameterCoercionFormatter {
    private static final Logger log = LoggerFactory.getLogger(ParameterCoercionFormatter.class);

    public static final String UNSTRUCT_EVENT_SCHEMA =
            "iglu:com.snowplowanalytics.snowplow/unstruct_event/jsonschema/1-0-0";
    /** Parámetros del tracker que van arriba, fuera del evento embebido. */
    public static final List<String> PASSTHROUGH_PARAMS = List.of("nuid", "aid", "cv", "eid", "ttm", "url");

    private static final DateTimeFormatter CANONICAL_DATETIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);
    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "y", "t", "on");
    private static final Set<String> FALSY = Set.of("false", "0", "no", "n", "f", "off");

    private final FieldTypePlan plan;
    private final SchemaRef schema;
    private final String trackerVersion;
    private final CoercionPolicy policy;
    private final DateTimeFormatter sourceDateTime;   // null si el plan no tiene fechas

    public ParameterCoercionFormatter(FieldTypePlan plan, SchemaRef schema, String trackerVersion,
                                      CoercionPolicy policy) {
        this.plan = Objects.requireNonNull(plan, "plan");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.trackerVersion = Objects.requireNonNull(trackerVersion, "trackerVersion");
        this.policy = policy != null ? policy : CoercionPolicy.DROP;
        this.sourceDateTime = plan.dateTimes() != null ? plan.dateTimes().formatter() : null;
    }

    public FieldTypePlan plan() { return plan; }
    public SchemaRef schema() { return schema; }
    public String trackerVersion() { return trackerVersion; }
    public CoercionPolicy policy() { return policy; }

    /**
     * Mapa con los valores de los campos declarados ya canónicos: booleanos
     * como "1"/"0", enteros tal cual, fechas en ISO-8601 UTC con milisegundos.
     * Aplicarlo sobre su propia salida no cambia nada.
     */
    public Outcome<Map<String, String>> coerce(Map<String, String> raw) {
        Accumulator<Map.Entry<String, String>> acc = new Accumulator<>();
        for (var en : raw.entrySet()) {
            String key = en.getKey();
            String value = en.getValue() == null ? "" : en.getValue();
            Optional<String> coerced;
            String expected;
            if (plan.isBoolean(key)) {
                coerced = coerceBoolean(value);
                expected = "boolean";
            } else if (plan.isInteger(key)) {
                coerced = coerceInteger(value);
                expected = "integer";
            } else if (plan.isDateTime(key)) {
                coerced = coerceDateTime(value);
                expected = "datetime with pattern " + plan.dateTimes().pattern();
            } else {
                acc.success(Map.entry(key, value));
                continue;
            }

            if (coerced.isPresent()) {
                acc.success(Map.entry(key, coerced.get()));
            } else if (policy == CoercionPolicy.REJECT) {
                acc.failure(Failure.of(FailureKind.COERCION_FAILURE,
                        "Value [%s] for key %s is not a valid %s", value, key, expected));
            } else {
                log.debug("[drop] field {} value [{}] is not a valid {}", key, value, expected);
            }
        }

        Optional<NonEmptyList<Failure>> failures = acc.failuresNel();
        if (failures.isPresent()) return Outcome.invalid(failures.get());
        Map<String, String> out = new LinkedHashMap<>();
        for (var en : acc.successes()) out.put(en.getKey(), en.getValue());
        return Outcome.valid(Collections.unmodifiableMap(out));
    }

    /** Parámetros del evento estructurado listos para un RawEvent. */
    public Outcome<Map<String, String>> format(Map<String, String> raw, String platform) {
        Map<String, String> embedded = new LinkedHashMap<>(raw);
        PASSTHROUGH_PARAMS.forEach(embedded::remove);

        return coerce(embedded).map(coerced -> {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("tv", trackerVersion);
            params.put("e", "ue");
            params.put("p", raw.getOrDefault("p", platform));
            params.put("ue_pr", JsonSupport.toJson(toStructuredEvent(coerced)));
            for (String k : PASSTHROUGH_PARAMS) {
                if (raw.containsKey(k)) params.put(k, raw.get(k));
            }
            return Collections.unmodifiableMap(params);
        });
    }

    private ObjectNode toStructuredEvent(Map<String, String> coerced) {
        ObjectNode data = JsonSupport.MAPPER.createObjectNode();
        for (var en : coerced.entrySet()) {
            String k = en.getKey();
            String v = en.getValue();
            if (v.isEmpty()) data.putNull(k);
            else if (plan.isBoolean(k)) data.put(k, "1".equals(v));
            else if (plan.isInteger(k)) data.put(k, new BigInteger(v));
            else data.put(k, v);
        }
        ObjectNode ue = JsonSupport.MAPPER.createObjectNode();
        ue.put("schema", UNSTRUCT_EVENT_SCHEMA);
        ObjectNode inner = ue.putObject("data");
        inner.put("schema", schema.toSchemaUri());
        inner.set("data", data);
        return ue;
    }

    // ===== Conversores =====
    // Los tres ignoran espacios alrededor del valor.

    private static Optional<String> coerceBoolean(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (TRUTHY.contains(v)) return Optional.of("1");
        if (FALSY.contains(v)) return Optional.of("0");
        return Optional.empty();
    }

    private static Optional<String> coerceInteger(String value) {
        String v = value.trim();
        return INTEGER.matcher(v).matches() ? Optional.of(v) : Optional.empty();
    }

    private Optional<String> coerceDateTime(String value) {
        String v = value.trim();
        if (v.isEmpty()) return Optional.empty();
        try {
            return Optional.of(CANONICAL_DATETIME.format(parseSource(v)));
        } catch (DateTimeException notSourcePattern) {
            // ya canónica (o ISO-8601 con offset)
            try {
                return Optional.of(CANONICAL_DATETIME.format(Instant.parse(v)));
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        }
    }

    /** Patrón sin hora: medianoche UTC. */
    private Instant parseSource(String value) {
        TemporalAccessor parsed = sourceDateTime.parseBest(value, ZonedDateTime::from, LocalDate::from);
        if (parsed instanceof ZonedDateTime zdt) return zdt.toInstant();
        return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
