package org.sqlmarshal.processor.generator;

import org.sqlmarshal.processor.connection.ConnectionStrategy;
import org.sqlmarshal.processor.type.ScalarKind;
import org.sqlmarshal.processor.type.TypeClassifier;
import org.sqlmarshal.processor.type.TypeDescriptor;

/// Per-unit state shared by the generators of one enclosing class.
public record SynthesisContext(TypeClassifier classifier, ConnectionStrategy connection, ImportTracker imports) {
    static final String DB_NULL = "org.sqlmarshal.DbNull";

    String dbNull() {
        return imports.use(DB_NULL) + ".VALUE";
    }

    /// Class literal handed to the runtime so the driver converts values to `type`.
    String valueClass(TypeDescriptor type) {
        return imports.use(ScalarKind.valueClass(type)) + ".class";
    }

    /// Expression converting a database value held by `expression` into `type`.
    String fromDatabase(String expression, TypeDescriptor type) {
        var cast = "(" + imports.render(type) + ") " + expression;
        if (type.isPrimitive() || !classifier.isNullable(type)) {
            return cast;
        }
        return expression + " == " + dbNull() + " ? null : " + cast;
    }
}
