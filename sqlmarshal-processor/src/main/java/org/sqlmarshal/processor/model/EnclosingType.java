package org.sqlmarshal.processor.model;

import java.util.List;

/// Abstract class declaring `@SqlMarshal` methods, as seen by the code emitter.
public record EnclosingType(String packageName,
                            String simpleName,
                            Visibility visibility,
                            List<ConstructorSpec> constructors) {
    public EnclosingType {
        constructors = List.copyOf(constructors);
    }
}
