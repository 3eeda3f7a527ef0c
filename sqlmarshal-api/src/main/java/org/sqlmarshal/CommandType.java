package org.sqlmarshal;

/// How [SqlCommand] interprets its command text.
public enum CommandType {
    /// Plain SQL statement, parameters referenced as `@name`.
    TEXT,
    /// Procedure invocation in the form `name @a, @b OUTPUT`.
    STORED_PROCEDURE
}
