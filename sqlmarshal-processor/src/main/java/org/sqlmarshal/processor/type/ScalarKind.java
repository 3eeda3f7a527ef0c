package org.sqlmarshal.processor.type;

import java.util.Set;

/// Closed set of scalar kinds with a direct JDBC type mapping.
public enum ScalarKind {
    TEXT(Set.of("java.lang.String")),
    BOOLEAN(Set.of("boolean", "java.lang.Boolean")),
    INT8(Set.of("byte", "java.lang.Byte")),
    INT16(Set.of("short", "java.lang.Short")),
    INT32(Set.of("int", "java.lang.Integer")),
    INT64(Set.of("long", "java.lang.Long")),
    FLOAT(Set.of("float", "java.lang.Float")),
    DOUBLE(Set.of("double", "java.lang.Double")),
    DECIMAL(Set.of("java.math.BigDecimal")),
    TIMESTAMP(Set.of("java.time.LocalDateTime", "java.sql.Timestamp")),
    UNSUPPORTED(Set.of());

    private final Set<String> javaTypes;

    ScalarKind(Set<String> javaTypes) {
        this.javaTypes = javaTypes;
    }

    public static ScalarKind of(TypeDescriptor type) {
        for (var kind : values()) {
            if (kind.javaTypes.contains(type.qualifiedName())) {
                return kind;
            }
        }
        return UNSUPPORTED;
    }

    public boolean isSupported() {
        return this != UNSUPPORTED;
    }

    /// Qualified name of the class the driver converts database values of `type` to; primitives map to their box.
    ///
    /// @throws UnsupportedTypeException when `type` has no scalar mapping
    public static String valueClass(TypeDescriptor type) {
        if (!of(type).isSupported()) {
            throw new UnsupportedTypeException("No JDBC type mapping for " + type.qualifiedName());
        }
        return switch (type.qualifiedName()) {
            case "boolean" -> "java.lang.Boolean";
            case "byte" -> "java.lang.Byte";
            case "short" -> "java.lang.Short";
            case "int" -> "java.lang.Integer";
            case "long" -> "java.lang.Long";
            case "float" -> "java.lang.Float";
            case "double" -> "java.lang.Double";
            default -> type.qualifiedName();
        };
    }

    /// Name of the `java.sql.Types` constant for `type`.
    ///
    /// @throws UnsupportedTypeException when `type` has no scalar mapping
    public static String jdbcType(TypeDescriptor type) {
        return switch (of(type)) {
            case TEXT -> "VARCHAR";
            case BOOLEAN -> "BOOLEAN";
            case INT8 -> "TINYINT";
            case INT16 -> "SMALLINT";
            case INT32 -> "INTEGER";
            case INT64 -> "BIGINT";
            case FLOAT -> "REAL";
            case DOUBLE -> "DOUBLE";
            case DECIMAL -> "DECIMAL";
            case TIMESTAMP -> "TIMESTAMP";
            case UNSUPPORTED -> throw new UnsupportedTypeException("No JDBC type mapping for " + type.qualifiedName());
        };
    }
}
