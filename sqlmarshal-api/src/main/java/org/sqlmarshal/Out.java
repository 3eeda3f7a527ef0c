package org.sqlmarshal;

import org.jspecify.annotations.Nullable;

/// Output-only parameter slot of a [SqlMarshal] method. The generated code stores the value
/// returned by the database after execution.
public final class Out<T extends @Nullable Object> {
    private @Nullable T value;

    private Out(@Nullable T value) {
        this.value = value;
    }

    public static <T extends @Nullable Object> Out<T> out() {
        return new Out<>(null);
    }

    public static <T extends @Nullable Object> Out<T> out(@Nullable T initial) {
        return new Out<>(initial);
    }

    public @Nullable T get() {
        return value;
    }

    public void set(@Nullable T value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return "Out(" + value + ")";
    }
}
