package org.sqlmarshal.processor.generator;

/// Indent-aware source text accumulator.
///
/// Every line of generated Java goes through a builder; blocks opened with [#open(String)] must be
/// closed with [#close()], [#closeWith(String)] or continued with [#next(String)].
public final class CodeBuilder {
    private static final String INDENT = "    ";

    private final StringBuilder text = new StringBuilder();
    private int depth;

    public CodeBuilder() {
        this(0);
    }

    public CodeBuilder(int depth) {
        this.depth = depth;
    }

    public int depth() {
        return depth;
    }

    public CodeBuilder line(String content) {
        if (content.isEmpty()) {
            return blank();
        }
        text.append(INDENT.repeat(depth)).append(content).append('\n');
        return this;
    }

    public CodeBuilder blank() {
        text.append('\n');
        return this;
    }

    /// Emits `header {` and indents the following lines.
    public CodeBuilder open(String header) {
        line(header + " {");
        depth++;
        return this;
    }

    public CodeBuilder close() {
        return closeWith("");
    }

    /// Closes the current block with `}` followed by `suffix`, e.g. `;` for an array initializer.
    public CodeBuilder closeWith(String suffix) {
        outdent();
        return line("}" + suffix);
    }

    /// Closes the current block and opens a sibling on the same line: `} header {`.
    public CodeBuilder next(String header) {
        outdent();
        line("} " + header + " {");
        depth++;
        return this;
    }

    /// Appends text produced by another builder verbatim.
    public CodeBuilder append(CodeBuilder other) {
        text.append(other.text);
        return this;
    }

    public String build() {
        return text.toString();
    }

    /// Java string literal with quotes and escapes.
    public static String literal(String value) {
        var sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private void outdent() {
        if (depth == 0) {
            throw new IllegalStateException("No open block to close");
        }
        depth--;
    }
}
