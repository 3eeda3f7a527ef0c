package org.sqlmarshal.processor.connection;

import org.sqlmarshal.processor.type.TypeDescriptor;

/// How generated code obtains a live JDBC connection.
public sealed interface ConnectionStrategy {
    String DEFAULT_CONTEXT_NAME = "context";

    /// A `java.sql.Connection` field of the enclosing class.
    record Found(String fieldName) implements ConnectionStrategy {}

    /// A jOOQ `DSLContext` field of the enclosing class.
    record FoundContext(String fieldName, TypeDescriptor contextType) implements ConnectionStrategy {}

    /// No connection or context field; a context field named `contextName` is assumed by convention.
    record AssumedDefault(String contextName) implements ConnectionStrategy {}

    static ConnectionStrategy assumedDefault() {
        return new AssumedDefault(DEFAULT_CONTEXT_NAME);
    }

    /// Name of the field generated code reads.
    default String fieldName() {
        if (this instanceof Found found) {
            return found.fieldName();
        }
        if (this instanceof FoundContext context) {
            return context.fieldName();
        }
        return ((AssumedDefault) this).contextName();
    }

    /// Whether the connection is acquired and released by generated code.
    default boolean requiresExplicitOpenClose() {
        return !(this instanceof Found);
    }

    /// Whether rows can be mapped by the context instead of by generated code.
    default boolean hasContext() {
        return this instanceof FoundContext;
    }
}
