package com.qubi.hookhub.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Un request entrante tal cual lo entrega el transporte. Inmutable.
 */
public final class PayloadEnvelope {
    // --- obligatorios ---
    private final ApiRef api;
    private final List<QueryParam> querystring;   // ordenado, con claves repetidas
    private final Source source;
    private final RequestContext context;

    // --- opcionales ---
    private final String body;
    private final String contentType;

    private PayloadEnvelope(ApiRef api, List<QueryParam> querystring, Source source,
                            RequestContext context, String body, String contentType) {
        this.api = Objects.requireNonNull(api, "api");
        this.querystring = List.copyOf(querystring);
        this.source = source;
        this.context = (context != null) ? context : RequestContext.empty();
        this.body = body;
        this.contentType = contentType;
    }

    // --- getters ---
    public ApiRef api() { return api; }
    public List<QueryParam> querystring() { return querystring; }
    public Source source() { return source; }
    public RequestContext context() { return context; }
    /** null si el request no trae body. */
    public String body() { return body; }
    /** null si el request no declara content type. */
    public String contentType() { return contentType; }

    public boolean hasBody() { return body != null; }
    public boolean hasContentType() { return contentType != null; }

    /**
     * Aplana el querystring a un mapa; si una clave se repite gana la última.
     * Un valor ausente se toma como cadena vacía.
     */
    public Map<String, String> querystringAsMap() {
        Map<String, String> out = new LinkedHashMap<>();
        for (QueryParam p : querystring) {
            out.put(p.name(), p.value() == null ? "" : p.value());
        }
        return Collections.unmodifiableMap(out);
    }

    // --- builder ---
    public static Builder builder(ApiRef api) { return new Builder(api); }
    public static final class Builder {
        private final ApiRef api;
        private final List<QueryParam> querystring = new ArrayList<>();
        private Source source;
        private RequestContext context;
        private String body;
        private String contentType;

        private Builder(ApiRef api) { this.api = api; }

        public Builder param(String name, String value){ this.querystring.add(new QueryParam(name, value)); return this; }
        public Builder querystring(List<QueryParam> qs){ if(qs!=null) this.querystring.addAll(qs); return this; }
        public Builder source(Source s){ this.source = s; return this; }
        public Builder context(RequestContext c){ this.context = c; return this; }
        public Builder body(String b){ this.body = b; return this; }
        public Builder contentType(String ct){ this.contentType = ct; return this; }

        public PayloadEnvelope build() {
            return new PayloadEnvelope(api, querystring, source, context, body, contentType);
        }
    }
}
