package com.qubi.hookhub.core.model;

import java.util.Objects;

/** Endpoint lógico al que pegó el request, p.ej. ("com.callrail", "v1"). */
public record ApiRef(String vendor, String version) {
    public ApiRef {
        Objects.requireNonNull(vendor, "vendor");
        Objects.requireNonNull(version, "version");
    }

    @Override public String toString() { return vendor + "/" + version; }
}
