package org.sqlmarshal.processor.generator;

/// Source file produced for one enclosing class.
public record GeneratedUnit(String packageName, String simpleName, String source) {
    public String qualifiedName() {
        return packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
    }
}
