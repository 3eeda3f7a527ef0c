package org.sqlmarshal.processor.model;

/// Where the command text of a declaration comes from.
public sealed interface CommandSource {
    /// Supplied at call time by the `@RawSql` parameter.
    record RawText(String parameterName) implements CommandSource {}

    /// Invocation of the named stored procedure.
    record NamedProcedure(String name) implements CommandSource {}
}
