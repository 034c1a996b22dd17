package com.qubi.hookhub.core.validation;

public enum FailureKind {
    EMPTY_INPUT,            // ni body ni querystring
    CONTENT_TYPE_MISMATCH,  // content type no permitido o inconsistente con el body
    BODY_PARSE_ERROR,       // body no es JSON
    SCHEMA_VIOLATION,       // JSON no cumple el schema (o el validador falló)
    FIELD_TYPE_ERROR,       // campo que no es string (se acumulan)
    EMPTY_EVENT_BATCH,      // body válido pero sin eventos
    COERCION_FAILURE,       // boolean/int/fecha no parseable (solo con CoercionPolicy.REJECT)
    UNSUPPORTED_API         // ningún adapter para ese vendor/version
}
