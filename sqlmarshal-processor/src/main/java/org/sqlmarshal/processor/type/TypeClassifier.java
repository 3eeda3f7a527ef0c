package org.sqlmarshal.processor.type;

import java.util.Set;

/// Maps declared types to [TypeClassification]s.
///
/// Classification is a pure function of the type and the nullability mode; nothing is cached.
public final class TypeClassifier {
    public static final String OPTIONAL = "java.util.Optional";
    public static final Set<String> COLLECTIONS = Set.of("java.util.List",
                                                         "java.util.Collection",
                                                         "java.lang.Iterable",
                                                         "java.util.ArrayList");
    private static final String ITERABLE = "java.lang.Iterable";
    private static final Set<String> UNMAPPED_PRIMITIVES = Set.of("char", "java.lang.Character");

    private final NullabilityMode mode;

    public TypeClassifier(NullabilityMode mode) {
        this.mode = mode;
    }

    public NullabilityMode mode() {
        return mode;
    }

    public TypeClassification classify(TypeDescriptor type) {
        if (type.isVoid() || type.is("java.lang.Void")) {
            return TypeClassification.voidResult(type);
        }
        if (type.is(OPTIONAL)) {
            return classifyOptional(type);
        }

        var scalarKind = ScalarKind.of(type);
        if (scalarKind.isSupported()) {
            return TypeClassification.scalar(type, scalarKind, isNullable(type));
        }
        if (type.isPrimitive() || UNMAPPED_PRIMITIVES.contains(type.qualifiedName())) {
            throw new UnsupportedTypeException("No scalar mapping for " + type.qualifiedName());
        }

        var underlying = underlyingType(type);
        if (underlying != type && type.isAssignableTo(ITERABLE)) {
            if (!COLLECTIONS.contains(type.qualifiedName())) {
                throw new UnsupportedTypeException("Unsupported collection type " + type.qualifiedName()
                                                   + ", declare List, Collection or Iterable");
            }
            return TypeClassification.collection(type, underlying);
        }
        if (!type.isDeclared()) {
            throw new UnsupportedTypeException("Unsupported result type " + type.qualifiedName());
        }
        return TypeClassification.entity(type, isNullable(type));
    }

    /// Whether a value of `type` may be null under the active mode.
    public boolean isNullable(TypeDescriptor type) {
        if (type.isPrimitive()) {
            return false;
        }
        if (type.is(OPTIONAL)) {
            return true;
        }
        return switch (mode) {
            case OBLIVIOUS -> true;
            case ANNOTATED -> type.nullableAnnotation().isPresent();
        };
    }

    /// The single type argument of a generic type, or the type itself.
    public static TypeDescriptor underlyingType(TypeDescriptor type) {
        var arguments = type.typeArguments();
        if (!type.isDeclared() || arguments.size() != 1) {
            return type;
        }
        var argument = arguments.get(0);
        if (argument.shape() == TypeDescriptor.Shape.WILDCARD && argument.typeArguments().size() == 1) {
            return argument.typeArguments().get(0);
        }
        return argument;
    }

    private TypeClassification classifyOptional(TypeDescriptor type) {
        var wrapped = underlyingType(type);
        if (wrapped == type) {
            throw new UnsupportedTypeException("Raw Optional has no value type");
        }
        var inner = classify(wrapped);
        if (inner.optional() || inner.kind() == TypeClassification.Kind.VOID || inner.isList()) {
            throw new UnsupportedTypeException("Unsupported optional type Optional<" + wrapped.qualifiedName() + ">");
        }
        return inner.wrappedIn(type);
    }
}
