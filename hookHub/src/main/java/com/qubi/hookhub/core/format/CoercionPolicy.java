package com.qubi.hookhub.core.format;

/** Qué hacer con un campo declarado cuyo valor no se puede convertir. */
public enum CoercionPolicy {
    /** Se omite el campo y el resto del evento sigue. */
    DROP,
    /** Se reporta COERCION_FAILURE por cada campo y el request falla. */
    REJECT
}
