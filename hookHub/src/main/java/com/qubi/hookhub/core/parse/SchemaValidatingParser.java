package com.qubi.hookhub.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.qubi.hookhub.core.model.JsonSupport;
import com.qubi.hookhub.core.model.NonEmptyList;
import com.qubi.hookhub.core.model.PayloadEnvelope;
import com.qubi.hookhub.core.model.SchemaRef;
import com.qubi.hookhub.core.spi.SchemaValidator;
import com.qubi.hookhub.core.validation.Accumulator;
import com.qubi.hookhub.core.validation.Failure;
import com.qubi.hookhub.core.validation.FailureKind;
import com.qubi.hookhub.core.validation.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Convierte un envelope en uno o más mapas de parámetros, combinando el
 * querystring con los eventos de un body JSON validado contra un schema.
 *
 * <ol>
 *   <li>Precondiciones sobre (body, content type): fail-fast.</li>
 *   <li>Parseo JSON y validación de schema: fail-fast.</li>
 *   <li>Extracción de campos: se acumulan todas las fallas de todos los eventos.</li>
 * </ol>
 *
 * Los valores del querystring pisan a los del body cuando la clave coincide.
 * La instancia es inmutable y se comparte entre requests.
 */
public final class SchemaValidatingParser {
    private static final Logger log = LoggerFactory.getLogger(SchemaValidatingParser.class);

    private final SchemaRef bodySchema;
    private final List<String> allowedContentTypes;
    private final String allowedStr;

    public SchemaValidatingParser(SchemaRef bodySchema, List<String> allowedContentTypes) {
        this.bodySchema = Objects.requireNonNull(bodySchema, "bodySchema");
        if (allowedContentTypes == null || allowedContentTypes.isEmpty())
            throw new IllegalArgumentException("at least one allowed content type is required");
        this.allowedContentTypes = List.copyOf(allowedContentTypes);
        this.allowedStr = String.join(", ", this.allowedContentTypes);
    }

    public SchemaRef bodySchema() { return bodySchema; }
    public List<String> allowedContentTypes() { return allowedContentTypes; }

    public Outcome<NonEmptyList<Map<String, String>>> parse(PayloadEnvelope envelope, SchemaValidator validator) {
        Map<String, String> qsParams = envelope.querystringAsMap();
        String body = envelope.body();
        String ct = envelope.contentType();

        // el orden de las ramas importa: replica la tabla de precondiciones
        if (body == null && qsParams.isEmpty())
            return reject(Failure.of(FailureKind.EMPTY_INPUT,
                    "Request body and querystring parameters empty, expected at least one populated"));
        if (ct != null && !allowedContentTypes.contains(ct))
            return reject(Failure.of(FailureKind.CONTENT_TYPE_MISMATCH,
                    "Content type of %s provided, expected one of: %s", ct, allowedStr));
        if (body != null && ct == null)
            return reject(Failure.of(FailureKind.CONTENT_TYPE_MISMATCH,
                    "Request body provided but content type empty, expected one of: %s", allowedStr));
        if (body == null && ct != null)
            return reject(Failure.of(FailureKind.CONTENT_TYPE_MISMATCH,
                    "Content type of %s provided but request body empty", ct));
        if (body == null)
            return Outcome.valid(NonEmptyList.of(qsParams));

        Outcome<NonEmptyList<Map<String, String>>> result = JsonSupport.parse("Body", body)
                .flatMap(json -> validate(json, validator))
                .flatMap(events -> toParameters(events, qsParams));
        return result.isValid() ? result : reject(result.failures());
    }

    private Outcome<JsonNode> validate(JsonNode json, SchemaValidator validator) {
        try {
            return validator.validate(json, bodySchema);
        } catch (RuntimeException e) {
            log.warn("[schema] validator failed for {}: {}", bodySchema, e.toString());
            return Outcome.invalid(Failure.of(FailureKind.SCHEMA_VIOLATION,
                    "Could not validate body against %s: %s", bodySchema.toSchemaUri(), e.getMessage()));
        }
    }

    /**
     * Un mapa por evento, con {@code mergeWith} aplicado encima. Todas las
     * fallas de campo se juntan antes de decidir.
     */
    static Outcome<NonEmptyList<Map<String, String>>> toParameters(JsonNode events, Map<String, String> mergeWith) {
        if (!events.isArray())
            return Outcome.invalid(Failure.of(FailureKind.SCHEMA_VIOLATION,
                    "Body: expected an array of events, got %s", events.getNodeType()));

        Accumulator<Map<String, String>> acc = new Accumulator<>();
        int index = 0;
        for (JsonNode event : events) {
            if (!event.isObject()) {
                acc.failure(Failure.of(FailureKind.FIELD_TYPE_ERROR,
                        "Event at index %d is not an Object", index));
            } else {
                acc.add(toParameterMap(event, mergeWith));
            }
            index++;
        }

        Optional<NonEmptyList<Failure>> failures = acc.failuresNel();
        if (failures.isPresent()) return Outcome.invalid(failures.get());
        return NonEmptyList.from(acc.successes())
                .<Outcome<NonEmptyList<Map<String, String>>>>map(Outcome::valid)
                .orElseGet(() -> Outcome.invalid(Failure.of(FailureKind.EMPTY_EVENT_BATCH,
                        "List of events is empty (should never happen, did the JSON schema change?)")));
    }

    private static Outcome<Map<String, String>> toParameterMap(JsonNode event, Map<String, String> mergeWith) {
        Accumulator<Map.Entry<String, String>> fields = new Accumulator<>();
        Iterator<Map.Entry<String, JsonNode>> it = event.fields();
        while (it.hasNext()) {
            fields.add(toParameter(it.next()));
        }
        Optional<NonEmptyList<Failure>> failures = fields.failuresNel();
        if (failures.isPresent()) return Outcome.invalid(failures.get());

        Map<String, String> params = new LinkedHashMap<>();
        for (var en : fields.successes()) params.put(en.getKey(), en.getValue());
        params.putAll(mergeWith); // el querystring gana
        return Outcome.valid(Collections.unmodifiableMap(params));
    }

    private static Outcome<Map.Entry<String, String>> toParameter(Map.Entry<String, JsonNode> entry) {
        String key = entry.getKey();
        JsonNode raw = entry.getValue();
        if (raw.isTextual()) {
            String txt = raw.textValue();
            if (txt == null)
                return Outcome.invalid(Failure.of(FailureKind.FIELD_TYPE_ERROR,
                        "Value for key %s is a null String (should never happen, did the JSON implementation change?)", key));
            return Outcome.valid(Map.entry(key, txt));
        }
        return Outcome.invalid(Failure.of(FailureKind.FIELD_TYPE_ERROR,
                "Value for key %s is not a String (should never happen, did the JSON schema change?)", key));
    }

    private <T> Outcome<T> reject(Failure failure) {
        return reject(NonEmptyList.of(failure));
    }

    private <T> Outcome<T> reject(NonEmptyList<Failure> failures) {
        if (log.isDebugEnabled())
            log.debug("[reject] {} failure(s), first: {}", failures.size(), failures.head());
        return Outcome.invalid(failures);
    }
}
