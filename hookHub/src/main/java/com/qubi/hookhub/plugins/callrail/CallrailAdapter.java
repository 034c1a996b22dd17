package com.qubi.hookhub.plugins.callrail;

import com.qubi.hookhub.core.format.CoercionPolicy;
import com.qubi.hookhub.core.format.FieldTypePlan;
import com.qubi.hookhub.core.format.ParameterCoercionFormatter;
import com.qubi.hookhub.core.model.NonEmptyList;
import com.qubi.hookhub.core.model.PayloadEnvelope;
import com.qubi.hookhub.core.model.RawEvent;
import com.qubi.hookhub.core.model.SchemaRef;
import com.qubi.hookhub.core.spi.Adapter;
import com.qubi.hookhub.core.spi.SchemaValidator;
import com.qubi.hookhub.core.validation.Failure;
import com.qubi.hookhub.core.validation.FailureKind;
import com.qubi.hookhub.core.validation.Outcome;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Webhook "call complete" de CallRail. Un solo evento por request, todo en
 * el querystring; se reconstruye como evento estructurado call_complete.
 *
 * <p>Política de coerción: {@link CoercionPolicy#DROP}. CallRail no garantiza
 * el formato de sus campos, así que un valor que no parsea se omite y el
 * evento sigue. No usa el validador de schemas.
 */
public class CallrailAdapter implements Adapter {
    public static final String TRACKER_VERSION = "com.callrail-v1";
    public static final SchemaRef CALL_COMPLETE_SCHEMA =
            new SchemaRef("com.callrail", "call_complete", "jsonschema", "1-0-2");
    public static final String PLATFORM = "srv";
    public static final FieldTypePlan FIELD_TYPES = new FieldTypePlan(
            List.of("first_call", "answered"),
            List.of("duration"),
            new FieldTypePlan.DateTimeFields(List.of("datetime"), "yyyy-MM-dd HH:mm:ss"));

    private final ParameterCoercionFormatter formatter;
    private final String platform;

    public CallrailAdapter() {
        this(new ParameterCoercionFormatter(FIELD_TYPES, CALL_COMPLETE_SCHEMA, TRACKER_VERSION, CoercionPolicy.DROP),
                PLATFORM);
    }

    public CallrailAdapter(ParameterCoercionFormatter formatter, String platform) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.platform = platform != null ? platform : PLATFORM;
    }

    public ParameterCoercionFormatter formatter() { return formatter; }

    @Override
    public Outcome<NonEmptyList<RawEvent>> toRawEvents(PayloadEnvelope envelope, SchemaValidator validator) {
        Map<String, String> params = envelope.querystringAsMap();
        if (params.isEmpty())
            return Outcome.invalid(Failure.of(FailureKind.EMPTY_INPUT,
                    "Querystring is empty: no CallRail event to process"));
        return formatter.format(params, platform)
                .map(p -> NonEmptyList.of(RawEvent.of(envelope, p)));
    }
}
