package com.qubi.hookhub.config;

import com.qubi.hookhub.core.format.CoercionPolicy;
import com.qubi.hookhub.core.format.FieldTypePlan;
import com.qubi.hookhub.core.format.ParameterCoercionFormatter;
import com.qubi.hookhub.core.model.ApiRef;
import com.qubi.hookhub.core.model.SchemaRef;
import com.qubi.hookhub.core.runtime.AdapterRegistry;
import com.qubi.hookhub.core.schema.ClasspathSchemaValidator;
import com.qubi.hookhub.core.spi.Adapter;
import com.qubi.hookhub.plugins.callrail.CallrailAdapter;
import com.qubi.hookhub.plugins.tp2.Tp2Adapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Arma los adapters a partir de {@link AppConfig}. Cualquier error de
 * configuración se lanza acá, al arrancar.
 */
public final class AdapterFactory {
    private static final Logger log = LoggerFactory.getLogger(AdapterFactory.class);

    private AdapterFactory() {}

    public static AdapterRegistry registry(AppConfig cfg) {
        Map<ApiRef, Adapter> adapters = new LinkedHashMap<>();
        for (AppConfig.AdapterConfig ac : cfg.adapters) {
            if (ac.vendor == null || ac.version == null)
                throw new IllegalArgumentException("Adapter config requires vendor and version (type=" + ac.type + ")");
            ApiRef api = new ApiRef(ac.vendor, ac.version);
            if (adapters.put(api, create(ac)) != null)
                throw new IllegalArgumentException("Duplicate adapter for " + api);
            log.info("[adapter] {} -> {}", api, ac.type);
        }
        return new AdapterRegistry(adapters);
    }

    public static ClasspathSchemaValidator validator(AppConfig cfg) {
        return new ClasspathSchemaValidator(cfg.schemasRoot, AdapterFactory.class.getClassLoader());
    }

    static Adapter create(AppConfig.AdapterConfig ac) {
        String type = ac.type == null ? "" : ac.type.toLowerCase(Locale.ROOT);
        switch (type) {
            case "tp2":
                return new Tp2Adapter(
                        ac.bodySchema != null ? SchemaRef.parse(ac.bodySchema) : Tp2Adapter.PAYLOAD_DATA_SCHEMA,
                        ac.contentTypes != null ? ac.contentTypes : Tp2Adapter.CONTENT_TYPES);
            case "callrail":
                return new CallrailAdapter(formatter(ac), ac.platform);
            default:
                throw new IllegalArgumentException("Unknown adapter type: " + ac.type);
        }
    }

    private static ParameterCoercionFormatter formatter(AppConfig.AdapterConfig ac) {
        FieldTypePlan plan = CallrailAdapter.FIELD_TYPES;
        if (ac.booleans != null || ac.integers != null || ac.dateTimes != null) {
            plan = new FieldTypePlan(
                    ac.booleans != null ? ac.booleans : List.of(),
                    ac.integers != null ? ac.integers : List.of(),
                    ac.dateTimes != null
                            ? new FieldTypePlan.DateTimeFields(ac.dateTimes.fields, ac.dateTimes.pattern)
                            : null);
        }
        CoercionPolicy policy = ac.policy != null
                ? CoercionPolicy.valueOf(ac.policy.toUpperCase(Locale.ROOT))
                : CoercionPolicy.DROP;
        return new ParameterCoercionFormatter(
                plan,
                ac.schema != null ? SchemaRef.parse(ac.schema) : CallrailAdapter.CALL_COMPLETE_SCHEMA,
                ac.trackerVersion != null ? ac.trackerVersion : CallrailAdapter.TRACKER_VERSION,
                policy);
    }
}
