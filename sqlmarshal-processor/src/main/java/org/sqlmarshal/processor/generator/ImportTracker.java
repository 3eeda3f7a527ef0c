package org.sqlmarshal.processor.generator;

import org.sqlmarshal.processor.type.TypeDescriptor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/// Tracks imports during two-phase code generation.
/// Resolves qualified names to simple names where possible, falling back to the qualified name on collisions.
public final class ImportTracker {
    private static final String JAVA_LANG = "java.lang.";

    private final String currentPackage;
    private final Map<String, String> simpleToQualified = new LinkedHashMap<>();

    public ImportTracker(String currentPackage) {
        this.currentPackage = currentPackage;
    }

    /// Reserves a simple name declared by the generated unit itself.
    public void reserve(String simpleName) {
        simpleToQualified.putIfAbsent(simpleName, qualify(simpleName));
    }

    /// Name to write in source for the type `qualifiedName`.
    public String use(String qualifiedName) {
        var genericIdx = qualifiedName.indexOf('<');
        if (genericIdx > 0) {
            return use(qualifiedName.substring(0, genericIdx)) + qualifiedName.substring(genericIdx);
        }
        if (qualifiedName.endsWith("[]")) {
            return use(qualifiedName.substring(0, qualifiedName.length() - 2)) + "[]";
        }
        if (!qualifiedName.contains(".")) {
            return qualifiedName;
        }

        var simpleName = extractSimpleName(qualifiedName);
        var existing = simpleToQualified.get(simpleName);
        if (existing == null) {
            simpleToQualified.put(simpleName, qualifiedName);
            return simpleName;
        }
        return existing.equals(qualifiedName) ? simpleName : qualifiedName;
    }

    /// Source text of a type use, with type arguments, array brackets and wildcard bounds.
    public String render(TypeDescriptor type) {
        return switch (type.shape()) {
            case PRIMITIVE, VOID -> type.qualifiedName();
            case TYPE_VARIABLE -> type.simpleName();
            case ARRAY -> render(type.typeArguments().get(0)) + "[]";
            case WILDCARD -> type.typeArguments().isEmpty()
                             ? "?"
                             : "? " + type.wildcardKeyword() + " " + render(type.typeArguments().get(0));
            case DECLARED -> use(type.qualifiedName()) + renderArguments(type.typeArguments());
        };
    }

    /// [#render(TypeDescriptor)] preceded by the type's `@Nullable` annotation, when it carries one.
    public String renderAnnotated(TypeDescriptor type) {
        return type.nullableAnnotation()
                   .map(annotation -> "@" + use(annotation) + " " + render(type))
                   .orElseGet(() -> render(type));
    }

    /// Sorted import list, without `java.lang` and current-package types.
    public List<String> imports() {
        return simpleToQualified.values()
                                .stream()
                                .filter(q -> !isInCurrentPackage(q) && !isJavaLang(q))
                                .sorted()
                                .toList();
    }

    private String renderArguments(List<TypeDescriptor> arguments) {
        if (arguments.isEmpty()) {
            return "";
        }
        return arguments.stream()
                        .map(this::render)
                        .collect(Collectors.joining(", ", "<", ">"));
    }

    private String qualify(String simpleName) {
        return currentPackage.isEmpty() ? simpleName : currentPackage + "." + simpleName;
    }

    private static String extractSimpleName(String qualifiedName) {
        var lastDot = qualifiedName.lastIndexOf('.');
        return lastDot >= 0 ? qualifiedName.substring(lastDot + 1) : qualifiedName;
    }

    private boolean isInCurrentPackage(String qualifiedName) {
        if (currentPackage.isEmpty()) {
            return !qualifiedName.contains(".");
        }
        if (!qualifiedName.startsWith(currentPackage + ".")) {
            return false;
        }
        var remainder = qualifiedName.substring(currentPackage.length() + 1);
        return !remainder.contains(".");
    }

    private static boolean isJavaLang(String qualifiedName) {
        if (!qualifiedName.startsWith(JAVA_LANG)) {
            return false;
        }
        var remainder = qualifiedName.substring(JAVA_LANG.length());
        return !remainder.contains(".");
    }
}
