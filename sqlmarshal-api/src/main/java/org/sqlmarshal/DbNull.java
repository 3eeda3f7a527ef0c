package org.sqlmarshal;

/// Database null sentinel.
///
/// Bound as SQL NULL when set as a parameter value, and returned in place of SQL NULL by
/// [SqlCommand#executeScalar()], [SqlDataReader#getValue(int)] and output parameters.
public enum DbNull {
    VALUE;

    @Override
    public String toString() {
        return "DbNull";
    }
}
