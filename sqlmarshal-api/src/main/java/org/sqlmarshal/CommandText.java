package org.sqlmarshal;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/// Translates command text with `@name` parameter references into JDBC SQL with positional
/// `?` placeholders.
record CommandText(String sql, List<Reference> references) {
    record Reference(String name, boolean outputMarked) {}

    private static final String OUTPUT_MARKER = "OUTPUT";

    CommandText {
        references = List.copyOf(references);
    }

    static CommandText commandText(String text, CommandType type) {
        return type == CommandType.STORED_PROCEDURE
               ? procedureCall(text)
               : statement(text);
    }

    /// `name @a, @b OUTPUT` becomes `{call name(?, ?)}`.
    private static CommandText procedureCall(String text) {
        var trimmed = text.strip();
        var split = firstWhitespace(trimmed);

        if (split < 0) {
            return new CommandText("{call " + trimmed + "()}", List.of());
        }

        var procedureName = trimmed.substring(0, split);
        var references = new ArrayList<Reference>();

        for (var part : trimmed.substring(split).split(",")) {
            var tokens = part.strip().split("\\s+");

            if (tokens.length == 0 || tokens[0].isEmpty()) {
                continue;
            }
            if (!tokens[0].startsWith("@")) {
                throw new SqlMarshalException("Procedure argument must be a parameter reference: " + part.strip());
            }

            var outputMarked = tokens.length > 1 && OUTPUT_MARKER.equals(tokens[1].toUpperCase(Locale.ROOT));
            references.add(new Reference(tokens[0], outputMarked));
        }

        var placeholders = String.join(", ", references.stream().map(r -> "?").toList());
        return new CommandText("{call " + procedureName + "(" + placeholders + ")}", references);
    }

    private static CommandText statement(String text) {
        var sql = new StringBuilder(text.length());
        var references = new ArrayList<Reference>();
        var i = 0;

        while (i < text.length()) {
            var skipped = skippedSpanEnd(text, i);
            if (skipped > i) {
                sql.append(text, i, skipped);
                i = skipped;
                continue;
            }
            if (text.charAt(i) == '@' && startsReference(text, i)) {
                var end = i + 1;
                while (end < text.length() && Character.isJavaIdentifierPart(text.charAt(end))) {
                    end++;
                }
                references.add(new Reference(text.substring(i, end), false));
                sql.append('?');
                i = end;
                continue;
            }
            sql.append(text.charAt(i));
            i++;
        }

        return new CommandText(sql.toString(), references);
    }

    /// End of the string literal, quoted identifier or comment starting at `at`; `at` when none starts there.
    /// Unterminated spans run to the end of the text.
    private static int skippedSpanEnd(String text, int at) {
        var c = text.charAt(at);

        if (c == '\'' || c == '"') {
            var close = text.indexOf(c, at + 1);
            return close < 0 ? text.length() : close + 1;
        }
        if (text.startsWith("--", at)) {
            var newline = text.indexOf('\n', at);
            return newline < 0 ? text.length() : newline;
        }
        if (text.startsWith("/*", at)) {
            var close = text.indexOf("*/", at + 2);
            return close < 0 ? text.length() : close + 2;
        }
        return at;
    }

    private static boolean startsReference(String text, int at) {
        if (at + 1 >= text.length() || !Character.isJavaIdentifierStart(text.charAt(at + 1))) {
            return false;
        }
        if (at == 0) {
            return true;
        }
        // `@@ROWCOUNT` and `user@host` are not parameter references
        var previous = text.charAt(at - 1);
        return previous != '@' && !Character.isJavaIdentifierPart(previous);
    }

    private static int firstWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
