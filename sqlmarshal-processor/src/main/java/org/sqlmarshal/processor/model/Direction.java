package org.sqlmarshal.processor.model;

public enum Direction {
    IN,
    OUT,
    IN_OUT;

    public boolean isInput() {
        return this != OUT;
    }

    public boolean isOutput() {
        return this != IN;
    }
}
