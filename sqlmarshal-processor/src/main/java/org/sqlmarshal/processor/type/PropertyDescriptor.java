package org.sqlmarshal.processor.type;

import java.util.Optional;

/// A column-backed property of an entity type.
///
/// `ordinal` is the zero-based position among the entity's properties and equals the column index the
/// property is read from.
public record PropertyDescriptor(String name, TypeDescriptor type, int ordinal, Access access, Optional<String> setter) {
    public enum Access {
        /// Passed positionally to the canonical constructor of a record.
        CONSTRUCTOR,
        /// Assigned through `setter`.
        SETTER,
        /// Assigned directly to the field.
        FIELD,
        /// Private or final field without a setter.
        NONE
    }

    public static PropertyDescriptor component(String name, TypeDescriptor type, int ordinal) {
        return new PropertyDescriptor(name, type, ordinal, Access.CONSTRUCTOR, Optional.empty());
    }

    public static PropertyDescriptor setter(String name, TypeDescriptor type, int ordinal, String setter) {
        return new PropertyDescriptor(name, type, ordinal, Access.SETTER, Optional.of(setter));
    }

    public static PropertyDescriptor field(String name, TypeDescriptor type, int ordinal, boolean readOnly) {
        return new PropertyDescriptor(name, type, ordinal, readOnly ? Access.NONE : Access.FIELD, Optional.empty());
    }
}
