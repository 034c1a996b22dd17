package com.qubi.hookhub.core.validation;

import java.util.Objects;

public record Failure(FailureKind kind, String message) {
    public Failure {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static Failure of(FailureKind kind, String format, Object... args) {
        return new Failure(kind, args.length == 0 ? format : String.format(format, args));
    }

    @Override public String toString() { return kind + ": " + message; }
}
