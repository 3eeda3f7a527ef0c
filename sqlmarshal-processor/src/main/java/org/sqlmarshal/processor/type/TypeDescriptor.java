package org.sqlmarshal.processor.type;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/// The part of a host type system the synthesis engine relies on.
///
/// Implemented over `javax.lang.model` for annotation processing and in memory for tests.
public interface TypeDescriptor {
    enum Shape {
        PRIMITIVE,
        VOID,
        DECLARED,
        ARRAY,
        WILDCARD,
        TYPE_VARIABLE
    }

    Shape shape();

    /// Qualified name of a declared type, keyword of a primitive, `void`, `?` for a wildcard.
    String qualifiedName();

    String simpleName();

    /// Type arguments of a declared type, the component of an array, the bound of a wildcard.
    List<TypeDescriptor> typeArguments();

    /// `extends`, `super`, or empty for an unbounded wildcard and every other shape.
    default String wildcardKeyword() {
        return "";
    }

    /// Direct supertypes, superclass first.
    List<TypeDescriptor> supertypes();

    /// Declared instance fields, in declaration order.
    List<MemberDescriptor> fields();

    /// Declared instance methods without parameters and with a non-void result.
    List<MemberDescriptor> accessors();

    /// Assignable row properties in declaration order: record components, or instance fields.
    List<PropertyDescriptor> properties();

    boolean isRecord();

    /// Qualified name of the `@Nullable` annotation on this type use or its declaration.
    Optional<String> nullableAnnotation();

    default boolean isPrimitive() {
        return shape() == Shape.PRIMITIVE;
    }

    default boolean isVoid() {
        return shape() == Shape.VOID;
    }

    default boolean isDeclared() {
        return shape() == Shape.DECLARED;
    }

    default boolean is(String qualifiedName) {
        return qualifiedName().equals(qualifiedName);
    }

    /// Whether this type is, or transitively extends or implements, the named type.
    default boolean isAssignableTo(String qualifiedName) {
        return findSupertype(qualifiedName).isPresent();
    }

    /// This type or the first supertype with the given qualified name, breadth first.
    default Optional<TypeDescriptor> findSupertype(String qualifiedName) {
        var queue = new ArrayDeque<TypeDescriptor>();
        var seen = new HashSet<String>();
        queue.add(this);

        while (!queue.isEmpty()) {
            var current = queue.poll();
            if (current.is(qualifiedName)) {
                return Optional.of(current);
            }
            if (seen.add(current.qualifiedName())) {
                queue.addAll(current.supertypes());
            }
        }
        return Optional.empty();
    }
}
