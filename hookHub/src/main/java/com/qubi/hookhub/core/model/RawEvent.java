package com.qubi.hookhub.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Evento canónico que consume el pipeline de enriquecimiento.
 * {@code parameters} conserva el orden de inserción y es inmutable.
 */
public record RawEvent(
        ApiRef api,
        Map<String, String> parameters,
        String contentType,       // opcional
        Source source,
        RequestContext context
) {
    public RawEvent {
        Objects.requireNonNull(api, "api");
        Objects.requireNonNull(parameters, "parameters");
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /** Un RawEvent por cada mapa, todos con la metadata del envelope. */
    public static RawEvent of(PayloadEnvelope envelope, Map<String, String> parameters) {
        return new RawEvent(envelope.api(), parameters, envelope.contentType(),
                envelope.source(), envelope.context());
    }
}
