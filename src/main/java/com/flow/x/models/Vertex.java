package com.flow.x.models;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * Immutable identity of a graph vertex. Equality, hashing and ordering come from the wrapped value only.
 *
 * @param <T> type of the wrapped value
 */
@Getter
@EqualsAndHashCode
public final class Vertex<T extends Comparable<? super T>> implements Comparable<Vertex<T>> {

    private final T value;

    private Vertex(T value) {
        this.value = Objects.requireNonNull(value, "Vertex value cannot be null");
    }

    public static <T extends Comparable<? super T>> Vertex<T> of(T value) {
        return new Vertex<>(value);
    }

    /**
     * Rebuilds a vertex from its serialized form. Values always come back as strings.
     */
    public static Vertex<String> deserialize(String serialized) {
        return new Vertex<>(serialized);
    }

    public String serialize() {
        return String.valueOf(value);
    }

    @Override
    public int compareTo(Vertex<T> other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return "Vertex(" + value + ")";
    }
}
