package com.taskboard.servicebackend.task;

import java.util.Objects;

/**
 * One field of a partial update: left alone, cleared, or set to a value.
 */
public final class FieldPatch<T> {

    private enum State { UNSET, CLEAR, SET }

    private final State state;
    private final T value;

    private FieldPatch(State state, T value) {
        this.state = state;
        this.value = value;
    }

    public static <T> FieldPatch<T> unset() {
        return new FieldPatch<>(State.UNSET, null);
    }

    public static <T> FieldPatch<T> clear() {
        return new FieldPatch<>(State.CLEAR, null);
    }

    public static <T> FieldPatch<T> set(T value) {
        return new FieldPatch<>(State.SET, Objects.requireNonNull(value, "value"));
    }

    /** Supplied by the caller, either as a value or as a clear request. */
    public boolean isPresent() {
        return state != State.UNSET;
    }

    public boolean isClear() {
        return state == State.CLEAR;
    }

    public boolean isSet() {
        return state == State.SET;
    }

    public T value() {
        if (state != State.SET) {
            throw new IllegalStateException("No value in a " + state + " patch");
        }
        return value;
    }

    /** Value when set, {@code null} when cleared. Only meaningful for present patches. */
    public T valueOrNull() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldPatch<?> other)) return false;
        return state == other.state && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, value);
    }

    @Override
    public String toString() {
        return state == State.SET ? "SET(" + value + ")" : state.name();
    }
}
