package org.sqlmarshal;

public enum ParameterDirection {
    INPUT,
    OUTPUT,
    INPUT_OUTPUT;

    public boolean isInput() {
        return this != OUTPUT;
    }

    public boolean isOutput() {
        return this != INPUT;
    }
}
