package org.sqlmarshal.processor.type;

/// A type outside the enumerated scalar set was asked for a database type mapping.
public class UnsupportedTypeException extends RuntimeException {
    public UnsupportedTypeException(String message) {
        super(message);
    }
}
