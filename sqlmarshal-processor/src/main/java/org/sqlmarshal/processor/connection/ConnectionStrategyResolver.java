package org.sqlmarshal.processor.connection;

import org.sqlmarshal.processor.DeclarationException;
import org.sqlmarshal.processor.type.MemberDescriptor;
import org.sqlmarshal.processor.type.TypeDescriptor;

import java.util.Optional;

/// Selects the [ConnectionStrategy] of an enclosing class from its declared fields.
///
/// A connection field wins over a context field; with neither the default context name is assumed.
public final class ConnectionStrategyResolver {
    public static final String CONNECTION_TYPE = "java.sql.Connection";
    public static final String CONTEXT_TYPE = "org.jooq.DSLContext";

    private ConnectionStrategyResolver() {}

    public static ConnectionStrategy resolve(TypeDescriptor enclosingType) {
        var connection = firstFieldOf(enclosingType, CONNECTION_TYPE);
        if (connection.isPresent()) {
            return new ConnectionStrategy.Found(accessible(connection.get(), enclosingType).name());
        }

        var context = firstFieldOf(enclosingType, CONTEXT_TYPE);
        if (context.isPresent()) {
            var field = accessible(context.get(), enclosingType);
            return new ConnectionStrategy.FoundContext(field.name(), field.type());
        }
        return ConnectionStrategy.assumedDefault();
    }

    private static Optional<MemberDescriptor> firstFieldOf(TypeDescriptor enclosingType, String qualifiedName) {
        return enclosingType.fields()
                            .stream()
                            .filter(field -> field.type().isAssignableTo(qualifiedName))
                            .findFirst();
    }

    private static MemberDescriptor accessible(MemberDescriptor field, TypeDescriptor enclosingType) {
        if (field.isPrivate()) {
            throw new DeclarationException("Field '" + field.name() + "' of " + enclosingType.simpleName()
                                           + " is private and cannot be used by the generated subclass");
        }
        return field;
    }
}
