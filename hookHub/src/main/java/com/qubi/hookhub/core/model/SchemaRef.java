package com.qubi.hookhub.core.model;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Referencia a un schema: vendor/name/format/version, con version en la forma
 * MODEL-REVISION-ADDITION. Se escribe como {@code iglu:vendor/name/format/1-0-2}.
 */
public record SchemaRef(String vendor, String name, String format, String version) {
    private static final Pattern URI =
            Pattern.compile("^iglu:([a-zA-Z0-9_.\\-]+)/([a-zA-Z0-9_\\-]+)/([a-zA-Z0-9_\\-]+)/(\\d+-\\d+-\\d+)$");

    public SchemaRef {
        Objects.requireNonNull(vendor, "vendor");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(version, "version");
        if (!version.matches("\\d+-\\d+-\\d+"))
            throw new IllegalArgumentException("Schema version must be MODEL-REVISION-ADDITION, got " + version);
    }

    public static SchemaRef parse(String uri) {
        Matcher m = URI.matcher(uri == null ? "" : uri);
        if (!m.matches()) throw new IllegalArgumentException("Not a schema URI: " + uri);
        return new SchemaRef(m.group(1), m.group(2), m.group(3), m.group(4));
    }

    public int model() {
        return Integer.parseInt(version.substring(0, version.indexOf('-')));
    }

    /** Mismo vendor/name/format y mismo MODEL: las revisiones son compatibles. */
    public boolean isCompatibleWith(SchemaRef other) {
        return vendor.equals(other.vendor) && name.equals(other.name)
                && format.equals(other.format) && model() == other.model();
    }

    /** Path relativo dentro del classpath (sin extensión). */
    public String path() {
        return vendor + "/" + name + "/" + format + "/" + version;
    }

    public String toSchemaUri() { return "iglu:" + path(); }

    @Override public String toString() { return toSchemaUri(); }
}
