package org.sqlmarshal.processor.generator;

import java.util.Locale;

/// Naming conventions shared by the generators.
public final class NameMapper {
    private NameMapper() {}

    /// `clientId` -> `client_id`, `personID` -> `person_id`, `HTTPServer` -> `http_server`.
    public static String toSnakeCase(String name) {
        var sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && startsWord(name, i)) {
                    sb.append('_');
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /// Database-side name of a declared parameter.
    public static String externalName(String parameterName) {
        return "@" + toSnakeCase(parameterName);
    }

    /// Conventional entity set name for an entity type: `Person` -> `persons`.
    public static String entitySetName(String entitySimpleName) {
        return lowercaseFirst(entitySimpleName) + "s";
    }

    /// `Person` -> `person`, `URLParser` -> `urlParser`, `ID` -> `id`.
    public static String lowercaseFirst(String name) {
        int i = 0;
        while (i < name.length() && Character.isUpperCase(name.charAt(i))) {
            i++;
        }
        if (i == 0) {
            return name;
        }
        if (i == 1) {
            return Character.toLowerCase(name.charAt(0)) + name.substring(1);
        }
        if (i < name.length()) {
            return name.substring(0, i - 1).toLowerCase(Locale.ROOT) + name.substring(i - 1);
        }
        return name.toLowerCase(Locale.ROOT);
    }

    private static boolean startsWord(String name, int index) {
        char previous = name.charAt(index - 1);
        if (Character.isLowerCase(previous) || Character.isDigit(previous)) {
            return true;
        }
        return index + 1 < name.length() && Character.isLowerCase(name.charAt(index + 1));
    }
}
