package org.sqlmarshal.processor.model;

import javax.lang.model.element.Modifier;
import java.util.Set;

public enum Visibility {
    PUBLIC("public "),
    PROTECTED("protected "),
    PACKAGE(""),
    PRIVATE("private ");

    private final String keyword;

    Visibility(String keyword) {
        this.keyword = keyword;
    }

    /// Modifier text including the trailing space, empty for package-private.
    public String keyword() {
        return keyword;
    }

    public static Visibility of(Set<Modifier> modifiers) {
        if (modifiers.contains(Modifier.PUBLIC)) {
            return PUBLIC;
        }
        if (modifiers.contains(Modifier.PROTECTED)) {
            return PROTECTED;
        }
        if (modifiers.contains(Modifier.PRIVATE)) {
            return PRIVATE;
        }
        return PACKAGE;
    }
}
