package org.sqlmarshal;

/// Failure raised by the command runtime or by generated code whose method does not declare
/// `SQLException`.
public class SqlMarshalException extends RuntimeException {
    public SqlMarshalException(String message) {
        super(message);
    }

    public SqlMarshalException(String message, Throwable cause) {
        super(message, cause);
    }
}
