package com.qubi.hookhub.plugins.tp2;

import com.qubi.hookhub.core.model.NonEmptyList;
import com.qubi.hookhub.core.model.PayloadEnvelope;
import com.qubi.hookhub.core.model.RawEvent;
import com.qubi.hookhub.core.model.SchemaRef;
import com.qubi.hookhub.core.parse.SchemaValidatingParser;
import com.qubi.hookhub.core.spi.Adapter;
import com.qubi.hookhub.core.spi.SchemaValidator;
import com.qubi.hookhub.core.validation.Outcome;

import java.util.List;

/**
 * Tracker Protocol v2: GET con querystring, o POST con un body JSON
 * (payload_data) que trae uno o más eventos. En un POST el querystring
 * también cuenta y pisa los campos del body.
 */
public class Tp2Adapter implements Adapter {
    public static final SchemaRef PAYLOAD_DATA_SCHEMA =
            new SchemaRef("com.snowplowanalytics.snowplow", "payload_data", "jsonschema", "1-0-4");
    public static final List<String> CONTENT_TYPES =
            List.of("application/json", "application/json; charset=utf-8", "application/json; charset=UTF-8");

    private final SchemaValidatingParser parser;

    public Tp2Adapter() {
        this(PAYLOAD_DATA_SCHEMA, CONTENT_TYPES);
    }

    public Tp2Adapter(SchemaRef bodySchema, List<String> contentTypes) {
        this.parser = new SchemaValidatingParser(bodySchema, contentTypes);
    }

    public SchemaValidatingParser parser() { return parser; }

    @Override
    public Outcome<NonEmptyList<RawEvent>> toRawEvents(PayloadEnvelope envelope, SchemaValidator validator) {
        return parser.parse(envelope, validator)
                .map(paramsNel -> paramsNel.map(params -> RawEvent.of(envelope, params)));
    }
}
