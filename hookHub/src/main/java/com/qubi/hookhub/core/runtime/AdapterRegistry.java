// core/runtime/AdapterRegistry.java
package com.qubi.hookhub.core.runtime;
import com.qubi.hookhub.core.model.ApiRef;
import com.qubi.hookhub.core.model.NonEmptyList;
import com.qubi.hookhub.core.model.PayloadEnvelope;
import com.qubi.hookhub.core.model.RawEvent;
import com.qubi.hookhub.core.spi.Adapter;
import com.qubi.hookhub.core.spi.SchemaValidator;
import com.qubi.hookhub.core.validation.Failure;
import com.qubi.hookhub.core.validation.FailureKind;
import com.qubi.hookhub.core.validation.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Elige el adapter según vendor/version del envelope. Inmutable. */
public class AdapterRegistry {
  private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

  private final Map<ApiRef, Adapter> adapters;

  public AdapterRegistry(Map<ApiRef, Adapter> adapters){ this.adapters = Map.copyOf(adapters); }

  public Optional<Adapter> lookup(ApiRef api){ return Optional.ofNullable(adapters.get(api)); }

  public Set<ApiRef> apis(){ return adapters.keySet(); }

  public Outcome<NonEmptyList<RawEvent>> toRawEvents(PayloadEnvelope envelope, SchemaValidator validator){
    Adapter adapter = adapters.get(envelope.api());
    if (adapter == null) {
      log.debug("[unsupported] no adapter for {}", envelope.api());
      return Outcome.invalid(Failure.of(FailureKind.UNSUPPORTED_API,
          "Payload with vendor %s and version %s not supported",
          envelope.api().vendor(), envelope.api().version()));
    }
    return adapter.toRawEvents(envelope, validator);
  }
}
