package org.sqlmarshal.processor;

/// A `@SqlMarshal` declaration violates a structural precondition; its enclosing class is not generated.
public class DeclarationException extends RuntimeException {
    public DeclarationException(String message) {
        super(message);
    }
}
