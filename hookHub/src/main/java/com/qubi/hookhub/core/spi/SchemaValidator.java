package com.qubi.hookhub.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.qubi.hookhub.core.model.SchemaRef;
import com.qubi.hookhub.core.validation.Outcome;

/**
 * Colaborador externo que valida un documento contra un schema. Puede ser
 * lento (lookup remoto); quien lo llama no debe tener locks tomados.
 */
@FunctionalInterface
public interface SchemaValidator {
    /** Devuelve el documento validado (o su {@code data} si es self-describing). */
    Outcome<JsonNode> validate(JsonNode document, SchemaRef schema);
}
