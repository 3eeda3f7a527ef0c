package org.sqlmarshal.processor.type;

/// Classification of a declared type.
///
/// `underlyingType` is the row type of a collection, the wrapped type of an `Optional`, and the
/// declared type itself otherwise. `scalarKind` describes the underlying type.
public record TypeClassification(Kind kind,
                                 TypeDescriptor declaredType,
                                 TypeDescriptor underlyingType,
                                 boolean nullable,
                                 boolean optional,
                                 ScalarKind scalarKind) {
    public enum Kind {
        SCALAR,
        ENTITY,
        ENTITY_COLLECTION,
        VOID
    }

    static TypeClassification voidResult(TypeDescriptor type) {
        return new TypeClassification(Kind.VOID, type, type, false, false, ScalarKind.UNSUPPORTED);
    }

    static TypeClassification scalar(TypeDescriptor type, ScalarKind scalarKind, boolean nullable) {
        return new TypeClassification(Kind.SCALAR, type, type, nullable, false, scalarKind);
    }

    static TypeClassification entity(TypeDescriptor type, boolean nullable) {
        return new TypeClassification(Kind.ENTITY, type, type, nullable, false, ScalarKind.UNSUPPORTED);
    }

    static TypeClassification collection(TypeDescriptor type, TypeDescriptor itemType) {
        return new TypeClassification(Kind.ENTITY_COLLECTION, type, itemType, false, false, ScalarKind.of(itemType));
    }

    TypeClassification wrappedIn(TypeDescriptor optionalType) {
        return new TypeClassification(kind, optionalType, underlyingType, true, true, scalarKind);
    }

    public boolean isScalar() {
        return kind == Kind.SCALAR;
    }

    public boolean isList() {
        return kind == Kind.ENTITY_COLLECTION;
    }

    /// Collection whose rows are single scalar values rather than entities.
    public boolean hasScalarItems() {
        return isList() && scalarKind.isSupported();
    }
}
