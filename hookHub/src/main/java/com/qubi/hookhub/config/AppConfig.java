package com.qubi.hookhub.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.qubi.hookhub.core.model.JsonSupport;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    public static final String DEFAULT_RESOURCE = "hookhub.yaml";

    public List<AdapterConfig> adapters = new ArrayList<>();
    /** Raíz de los schemas en el classpath. */
    public String schemasRoot = "schemas";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AdapterConfig {
        /** "tp2" | "callrail" */
        public String type;
        public String vendor;
        public String version;

        // --- batch (tp2) ---
        /** URI del schema del body; default payload_data 1-0-4. */
        public String bodySchema;
        public List<String> contentTypes;

        // --- coerción (callrail) ---
        public String trackerVersion;
        /** URI del schema del evento reconstruido. */
        public String schema;
        public String platform;
        /** DROP (default) o REJECT. */
        public String policy;
        public List<String> booleans;
        public List<String> integers;
        public DateTimeConfig dateTimes;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DateTimeConfig {
        public List<String> fields;
        public String pattern;              // ej. "yyyy-MM-dd HH:mm:ss", UTC
    }

    public static AppConfig load(InputStream yaml) {
        try {
            AppConfig cfg = JsonSupport.YAML.readValue(yaml, AppConfig.class);
            return cfg != null ? cfg : new AppConfig();
        } catch (IOException e) {
            throw new UncheckedIOException("Error loading hookHub config", e);
        }
    }

    /** Carga {@value #DEFAULT_RESOURCE} del classpath. */
    public static AppConfig loadDefault() {
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
