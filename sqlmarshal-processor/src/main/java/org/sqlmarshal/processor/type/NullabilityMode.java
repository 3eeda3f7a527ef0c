package org.sqlmarshal.processor.type;

import java.util.Locale;
import java.util.Optional;

/// How the processor decides whether a reference type may hold `null`.
public enum NullabilityMode {
    /// Every reference type may be null.
    OBLIVIOUS,
    /// A reference type may be null only when annotated `@Nullable`.
    ANNOTATED;

    /// Parses the `sqlmarshal.nullability` option. `auto` and absent values yield empty.
    public static Optional<NullabilityMode> fromOption(String value) {
        var normalized = value.strip().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "annotated" -> Optional.of(ANNOTATED);
            case "oblivious" -> Optional.of(OBLIVIOUS);
            case "", "auto" -> Optional.empty();
            default -> throw new IllegalArgumentException("Unknown nullability mode '" + value
                                                          + "', expected auto, annotated or oblivious");
        };
    }
}
