package com.qubi.hookhub.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import com.qubi.hookhub.core.model.JsonSupport;
import com.qubi.hookhub.core.model.NonEmptyList;
import com.qubi.hookhub.core.model.SchemaRef;
import com.qubi.hookhub.core.spi.SchemaValidator;
import com.qubi.hookhub.core.validation.Failure;
import com.qubi.hookhub.core.validation.FailureKind;
import com.qubi.hookhub.core.validation.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Validador que busca los schemas en el classpath bajo
 * {@code <root>/<vendor>/<name>/<format>/<version>} (JSON Schema 2020-12).
 *
 * <p>Si el documento es self-describing ({@code {"schema": ..., "data": ...}})
 * se exige que el schema declarado sea compatible con el esperado (mismo
 * MODEL), se valida {@code data} contra la versión declarada y se devuelve
 * {@code data}. Si no, se valida el documento entero contra el esperado.
 */
public final class ClasspathSchemaValidator implements SchemaValidator {
    private static final Logger log = LoggerFactory.getLogger(ClasspathSchemaValidator.class);
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final String root;
    private final ClassLoader loader;
    private final ConcurrentMap<SchemaRef, JsonSchema> cache = new ConcurrentHashMap<>();

    public ClasspathSchemaValidator() {
        this("schemas", ClasspathSchemaValidator.class.getClassLoader());
    }

    public ClasspathSchemaValidator(String root, ClassLoader loader) {
        this.root = root.endsWith("/") ? root.substring(0, root.length() - 1) : root;
        this.loader = loader;
    }

    @Override
    public Outcome<JsonNode> validate(JsonNode document, SchemaRef expected) {
        if (!isSelfDescribing(document)) return check(document, expected);

        String declared = document.get("schema").textValue();
        SchemaRef ref;
        try {
            ref = SchemaRef.parse(declared);
        } catch (IllegalArgumentException e) {
            return Outcome.invalid(Failure.of(FailureKind.SCHEMA_VIOLATION,
                    "Self-describing JSON declares an invalid schema [%s]", declared));
        }
        if (!ref.isCompatibleWith(expected))
            return Outcome.invalid(Failure.of(FailureKind.SCHEMA_VIOLATION,
                    "Verifying schema as %s failed: found %s", expected.toSchemaUri(), ref.toSchemaUri()));
        return check(document.get("data"), ref);
    }

    private static boolean isSelfDescribing(JsonNode doc) {
        return doc.isObject() && doc.size() == 2
                && doc.path("schema").isTextual() && doc.has("data");
    }

    private Outcome<JsonNode> check(JsonNode instance, SchemaRef ref) {
        return lookup(ref).flatMap(schema -> {
            Set<ValidationMessage> errors = schema.validate(instance);
            if (errors.isEmpty()) return Outcome.valid(instance);
            List<Failure> failures = new ArrayList<>(errors.size());
            for (ValidationMessage m : errors)
                failures.add(new Failure(FailureKind.SCHEMA_VIOLATION, m.getMessage()));
            log.debug("[schema] {} violation(s) against {}", failures.size(), ref);
            return Outcome.invalid(NonEmptyList.from(failures).orElseThrow());
        });
    }

    private Outcome<JsonSchema> lookup(SchemaRef ref) {
        JsonSchema cached = cache.get(ref);
        if (cached != null) return Outcome.valid(cached);

        String path = root + "/" + ref.path();
        try (InputStream in = loader.getResourceAsStream(path)) {
            if (in == null)
                return Outcome.invalid(Failure.of(FailureKind.SCHEMA_VIOLATION,
                        "Could not find schema %s", ref.toSchemaUri()));
            JsonSchema schema = SCHEMA_FACTORY.getSchema(JsonSupport.MAPPER.readTree(in));
            JsonSchema prev = cache.putIfAbsent(ref, schema);
            log.debug("[schema] loaded {} from classpath:{}", ref, path);
            return Outcome.valid(prev != null ? prev : schema);
        } catch (IOException | RuntimeException e) {
            log.warn("[schema] could not load {} from classpath:{}: {}", ref, path, e.toString());
            return Outcome.invalid(Failure.of(FailureKind.SCHEMA_VIOLATION,
                    "Could not load schema %s: %s", ref.toSchemaUri(), e.getMessage()));
        }
    }
}
