package org.sqlmarshal;

import org.jspecify.annotations.Nullable;

import java.sql.Types;

/// One named, typed, directional slot bound to a [SqlCommand].
///
/// Instances are created by [SqlCommand#createParameter()]. The name carries the `@` marker
/// used to reference the parameter from the command text. A `null` value is stored as
/// [DbNull#VALUE].
public final class SqlParameter {
    private String name = "";
    private int sqlType = Types.NULL;
    private boolean sqlTypeSet;
    private ParameterDirection direction = ParameterDirection.INPUT;
    private Object value = DbNull.VALUE;
    private @Nullable Class<?> valueType;

    SqlParameter() {}

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /// `java.sql.Types` tag, [Types#NULL] until set explicitly.
    public int getSqlType() {
        return sqlType;
    }

    public void setSqlType(int sqlType) {
        this.sqlType = sqlType;
        this.sqlTypeSet = true;
    }

    public boolean hasSqlType() {
        return sqlTypeSet;
    }

    public ParameterDirection getDirection() {
        return direction;
    }

    public void setDirection(ParameterDirection direction) {
        this.direction = direction;
    }

    /// Java type output values are converted to when read back, `null` for the driver default.
    public @Nullable Class<?> getValueType() {
        return valueType;
    }

    public void setValueType(Class<?> valueType) {
        this.valueType = valueType;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(@Nullable Object value) {
        this.value = value == null ? DbNull.VALUE : value;
    }

    @Override
    public String toString() {
        return name + "(" + direction + ")=" + value;
    }
}
