package org.sqlmarshal.processor.model;

import org.sqlmarshal.processor.type.TypeDescriptor;

/// One declared parameter.
///
/// `signatureType` is the type as written; `declaredType` is the value type, which differs from it only for
/// `Out<T>` and `Ref<T>` holders.
public record ParameterSpec(String internalName,
                            TypeDescriptor declaredType,
                            TypeDescriptor signatureType,
                            Direction direction,
                            boolean rawSql) {
    public static ParameterSpec in(String name, TypeDescriptor type) {
        return new ParameterSpec(name, type, type, Direction.IN, false);
    }

    public static ParameterSpec rawSql(String name, TypeDescriptor type) {
        return new ParameterSpec(name, type, type, Direction.IN, true);
    }

    public static ParameterSpec holder(String name, TypeDescriptor valueType, TypeDescriptor holderType, Direction direction) {
        return new ParameterSpec(name, valueType, holderType, direction, false);
    }

    /// Local variable holding the bound parameter in generated code.
    public String parameterVariable() {
        return internalName + "Parameter";
    }
}
