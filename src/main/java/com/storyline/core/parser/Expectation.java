package com.storyline.core.parser;

/**
 * Something the grammar would have accepted at a failure position.
 *
 * @param type        expectation category
 * @param description human-readable form used in diagnostics, e.g. {@code "}"} or {@code [^{}]}
 */
public record Expectation(Type type, String description) implements Comparable<Expectation> {

    public enum Type { LITERAL, CLASS, END, OTHER }

    public static Expectation literal(String text) {
        return new Expectation(Type.LITERAL, "\"" + escape(text, false) + "\"");
    }

    /**
     * @param parts    the characters of the class, unescaped
     * @param inverted true for a negated class such as {@code [^{}]}
     */
    public static Expectation charClass(String parts, boolean inverted) {
        return new Expectation(Type.CLASS, "[" + (inverted ? "^" : "") + escape(parts, true) + "]");
    }

    public static Expectation end() {
        return new Expectation(Type.END, "end of input");
    }

    public static Expectation other(String description) {
        return new Expectation(Type.OTHER, description);
    }

    @Override
    public int compareTo(Expectation other) {
        return description.compareTo(other.description);
    }

    static String escape(String text, boolean inClass) {
        var sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\t' -> sb.append("\\t");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\0' -> sb.append("\\0");
                case '"' -> sb.append(inClass ? "\"" : "\\\"");
                case ']', '^', '-' -> sb.append(inClass ? "\\" + c : String.valueOf(c));
                default -> {
                    if (c < 0x20 || (c >= 0x7F && c <= 0x9F)) {
                        sb.append(String.format("\\x%02X", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }
}
