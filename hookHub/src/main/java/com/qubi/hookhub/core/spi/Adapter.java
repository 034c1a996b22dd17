package com.qubi.hookhub.core.spi;

import com.qubi.hookhub.core.model.NonEmptyList;
import com.qubi.hookhub.core.model.PayloadEnvelope;
import com.qubi.hookhub.core.model.RawEvent;
import com.qubi.hookhub.core.validation.Outcome;

/**
 * Un adapter por fuente externa (webhook/tracker). Convierte el envelope en uno
 * o más eventos canónicos.
 *
 * <p>Las implementaciones no guardan estado mutable: la misma instancia se
 * llama en paralelo desde varios requests. Todo error vuelve como
 * {@link Outcome.Invalid}, nunca como excepción.
 */
public interface Adapter {
    Outcome<NonEmptyList<RawEvent>> toRawEvents(PayloadEnvelope envelope, SchemaValidator validator);
}
