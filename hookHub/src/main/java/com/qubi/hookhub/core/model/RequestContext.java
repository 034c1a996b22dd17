package com.qubi.hookhub.core.model;

import java.time.Instant;
import java.util.List;

/** Metadata del request. El core no la interpreta, solo la copia a cada RawEvent. */
public record RequestContext(
        Instant timestamp,     // recepción en el collector
        String ipAddress,
        String userAgent,
        String refererUri,
        List<String> headers,
        String userId          // network user id (cookie), opcional
) {
    public RequestContext {
        headers = (headers == null) ? List.of() : List.copyOf(headers);
    }

    public static RequestContext empty() {
        return new RequestContext(null, null, null, null, List.of(), null);
    }
}
