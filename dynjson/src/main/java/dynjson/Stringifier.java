package dynjson;

import java.io.IOException;

/**
 * Writes any {@link JsonValue} as JSON text, choosing the format from the value's kind.
 *
 * <p> {@code indent == 0} selects the compact form. {@code indent > 0} selects the pretty form, with {@code step}
 * spaces added per nesting level; a negative {@code step} means "same as {@code indent}".
 *
 * @since 0.1.0
 */
public final class Stringifier {

    private Stringifier() {
        throw new UnsupportedOperationException();
    }

    /**
     * Write {@code value} to {@code out}.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * var sb = new StringBuilder();
     * Stringifier.stringify(new JsonObject().set("a", 1), sb, 2, 2);
     * // -> {
     * //      "a" : 1
     * //    }
     * }</pre>
     *
     * @param value  value to write, not {@code null}
     * @param out    output sink
     * @param indent indentation of the value's members, 0 for compact output
     * @param step   indentation added per nesting level
     * @throws JsonException.WriteException if the value cannot be represented or the sink fails
     */
    public static void stringify(JsonValue value, Appendable out, int indent, int step) {
        if (value instanceof JsonObject o) {
            o.stringify(out, indent, step);
            return;
        }
        if (value instanceof JsonArray a) {
            a.stringify(out, indent, step);
            return;
        }
        try {
            if (value instanceof JsonNull) out.append("null");
            else if (value instanceof JsonBoolean b) out.append(b.value() ? "true" : "false");
            else if (value instanceof JsonInteger i) out.append(Long.toString(i.value()));
            else if (value instanceof JsonDecimal d) writeDecimal(out, d.value());
            else if (value instanceof JsonString s) writeString(out, s.value());
            else throw new JsonException.WriteException("Unknown JsonValue type: " + value.getClass());
        } catch (IOException e) {
            throw new JsonException.WriteException("Failed to write " + value.type() + " value", e);
        }
    }

    /**
     * Returns the compact JSON text of {@code value}.
     */
    public static String condense(JsonValue value) {
        var sb = new StringBuilder();
        stringify(value, sb, 0, 0);
        return sb.toString();
    }

    static void writeDecimal(Appendable out, double d) throws IOException {
        // Avoid NaN/Infinity (not valid in JSON)
        if (Double.isNaN(d) || Double.isInfinite(d))
            throw new JsonException.WriteException("Cannot serialize NaN or Infinity as JSON number: " + d);
        out.append(Double.toString(d));
    }

    static void writeString(Appendable out, String s) throws IOException {
        out.append('"');
        escapeTo(out, s);
        out.append('"');
    }

    static void writeIndent(Appendable out, int indent) throws IOException {
        for (int i = 0; i < indent; i++) out.append(' ');
    }

    static void escapeTo(Appendable out, String s) throws IOException {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        out.append("\\u");
                        String hex = Integer.toHexString(c);
                        for (int k = hex.length(); k < 4; k++) out.append('0');
                        out.append(hex);
                    } else {
                        out.append(c);
                    }
                }
            }
        }
    }
}
