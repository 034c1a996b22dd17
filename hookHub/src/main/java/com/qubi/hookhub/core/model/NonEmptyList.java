package com.qubi.hookhub.core.model;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.RandomAccess;
import java.util.function.Function;

/**
 * Lista inmutable que nunca está vacía. El único modo de obtener una es con
 * {@link #of} o {@link #from}, así que quien la recibe no tiene que chequear
 * el caso vacío.
 */
public final class NonEmptyList<T> extends AbstractList<T> implements RandomAccess {
    private final List<T> items;

    private NonEmptyList(List<T> items) {
        this.items = items;
    }

    @SafeVarargs
    public static <T> NonEmptyList<T> of(T head, T... tail) {
        List<T> all = new ArrayList<>(1 + tail.length);
        all.add(head);
        Collections.addAll(all, tail);
        return new NonEmptyList<>(Collections.unmodifiableList(all));
    }

    /** Vacío si {@code items} está vacía. */
    public static <T> Optional<NonEmptyList<T>> from(List<? extends T> items) {
        if (items == null || items.isEmpty()) return Optional.empty();
        return Optional.of(new NonEmptyList<>(Collections.unmodifiableList(new ArrayList<>(items))));
    }

    public T head() { return items.get(0); }

    public List<T> tail() { return items.subList(1, items.size()); }

    public <U> NonEmptyList<U> map(Function<? super T, ? extends U> fn) {
        List<U> out = new ArrayList<>(items.size());
        for (T t : items) out.add(fn.apply(t));
        return new NonEmptyList<>(Collections.unmodifiableList(out));
    }

    @Override public T get(int index) { return items.get(index); }

    @Override public int size() { return items.size(); }
}
