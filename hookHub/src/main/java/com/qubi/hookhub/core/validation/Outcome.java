package com.qubi.hookhub.core.validation;

import com.qubi.hookhub.core.model.NonEmptyList;

import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Resultado de una validación: un valor, o una lista no vacía de fallas.
 *
 * <p>{@link #flatMap} corta en la primera falla (disciplina fail-fast).
 * Para juntar todas las fallas de una pasada usar {@link Accumulator}.
 */
public sealed interface Outcome<T> permits Outcome.Valid, Outcome.Invalid {

    static <T> Outcome<T> valid(T value) { return new Valid<>(value); }

    static <T> Outcome<T> invalid(Failure failure) { return new Invalid<>(NonEmptyList.of(failure)); }

    static <T> Outcome<T> invalid(NonEmptyList<Failure> failures) { return new Invalid<>(failures); }

    boolean isValid();

    /** @throws NoSuchElementException si es inválido */
    T value();

    /** @throws NoSuchElementException si es válido */
    NonEmptyList<Failure> failures();

    default NonEmptyList<String> messages() { return failures().map(Failure::message); }

    <U> Outcome<U> map(Function<? super T, ? extends U> fn);

    <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> fn);

    <R> R fold(Function<? super NonEmptyList<Failure>, ? extends R> onInvalid,
               Function<? super T, ? extends R> onValid);

    record Valid<T>(T value) implements Outcome<T> {
        @Override public boolean isValid() { return true; }
        @Override public NonEmptyList<Failure> failures() { throw new NoSuchElementException("valid outcome has no failures"); }
        @Override public <U> Outcome<U> map(Function<? super T, ? extends U> fn) { return new Valid<>(fn.apply(value)); }
        @Override public <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> fn) { return fn.apply(value); }
        @Override public <R> R fold(Function<? super NonEmptyList<Failure>, ? extends R> onInvalid,
                                    Function<? super T, ? extends R> onValid) { return onValid.apply(value); }
    }

    record Invalid<T>(NonEmptyList<Failure> failures) implements Outcome<T> {
        @Override public boolean isValid() { return false; }
        @Override public T value() { throw new NoSuchElementException("invalid outcome: " + failures); }
        @Override public <U> Outcome<U> map(Function<? super T, ? extends U> fn) { return new Invalid<>(failures); }
        @Override public <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> fn) { return new Invalid<>(failures); }
        @Override public <R> R fold(Function<? super NonEmptyList<Failure>, ? extends R> onInvalid,
                                    Function<? super T, ? extends R> onValid) { return onInvalid.apply(failures); }
    }
}
