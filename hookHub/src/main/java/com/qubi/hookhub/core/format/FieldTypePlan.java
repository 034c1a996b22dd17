package com.qubi.hookhub.core.format;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Qué campos crudos hay que reinterpretar como boolean, entero o fecha.
 * Las tres listas son disjuntas; si no, es un error de configuración.
 * Una clave repetida dentro de la misma lista se toma una sola vez.
 */
public record FieldTypePlan(
        List<String> booleans,
        List<String> integers,
        DateTimeFields dateTimes      // opcional
) {
    public FieldTypePlan {
        booleans = distinct(booleans);
        integers = distinct(integers);
        Set<String> seen = new HashSet<>();
        List<String> dts = dateTimes == null ? List.of() : dateTimes.fields();
        for (List<String> group : List.of(booleans, integers, dts))
            for (String k : group)
                if (!seen.add(k)) throw new IllegalArgumentException("Field " + k + " declared with more than one type");
    }

    static List<String> distinct(List<String> keys) {
        return keys == null ? List.of() : List.copyOf(new LinkedHashSet<>(keys));
    }

    public static FieldTypePlan none() { return new FieldTypePlan(List.of(), List.of(), null); }

    public boolean isBoolean(String key) { return booleans.contains(key); }
    public boolean isInteger(String key) { return integers.contains(key); }
    public boolean isDateTime(String key) { return dateTimes != null && dateTimes.fields().contains(key); }

    /** Grupo de campos fecha que comparten un mismo patrón de origen (UTC si el patrón no trae zona). */
    public record DateTimeFields(List<String> fields, String pattern) {
        public DateTimeFields {
            if (fields == null || fields.isEmpty())
                throw new IllegalArgumentException("dateTimes.fields must not be empty");
            if (pattern == null || pattern.isBlank())
                throw new IllegalArgumentException("dateTimes.pattern is required");
            fields = distinct(fields);
            formatter(pattern); // falla ya si el patrón es inválido
        }

        public DateTimeFormatter formatter() { return formatter(pattern); }

        /**
         * STRICT: una fecha imposible (ej. 30 de febrero) no parsea. Con STRICT
         * {@code yyyy} necesita la era, que por defecto es d.C.
         */
        private static DateTimeFormatter formatter(String pattern) {
            return new DateTimeFormatterBuilder()
                    .appendPattern(pattern)
                    .parseDefaulting(ChronoField.ERA, 1)
                    .toFormatter(Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT)
                    .withZone(ZoneOffset.UTC);
        }
    }
}
