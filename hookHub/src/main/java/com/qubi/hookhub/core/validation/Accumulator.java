package com.qubi.hookhub.core.validation;

import com.qubi.hookhub.core.model.NonEmptyList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Junta éxitos y fallas sin cortar en la primera falla. Es local a una
 * pasada de validación; no se comparte entre requests.
 */
public final class Accumulator<T> {
    private final List<T> successes = new ArrayList<>();
    private final List<Failure> failures = new ArrayList<>();

    public Accumulator<T> success(T value) { successes.add(value); return this; }

    public Accumulator<T> failure(Failure failure) { failures.add(failure); return this; }

    public Accumulator<T> add(Outcome<? extends T> outcome) {
        if (outcome.isValid()) successes.add(outcome.value());
        else failures.addAll(outcome.failures());
        return this;
    }

    public boolean hasFailures() { return !failures.isEmpty(); }

    public List<T> successes() { return Collections.unmodifiableList(successes); }

    public List<Failure> failures() { return Collections.unmodifiableList(failures); }

    /** Las fallas acumuladas, si hubo alguna. */
    public Optional<NonEmptyList<Failure>> failuresNel() { return NonEmptyList.from(failures); }
}
