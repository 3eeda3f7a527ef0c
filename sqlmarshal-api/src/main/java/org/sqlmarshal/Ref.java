package org.sqlmarshal;

import org.jspecify.annotations.Nullable;

/// Input/output parameter slot of a [SqlMarshal] method. The current value is bound before
/// execution and replaced with the value returned by the database afterwards.
public final class Ref<T extends @Nullable Object> {
    private @Nullable T value;

    private Ref(@Nullable T value) {
        this.value = value;
    }

    public static <T extends @Nullable Object> Ref<T> ref(@Nullable T value) {
        return new Ref<>(value);
    }

    public @Nullable T get() {
        return value;
    }

    public void set(@Nullable T value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return "Ref(" + value + ")";
    }
}
