package dynjson;

import java.util.Objects;

/**
 * Static entry points for parsing and writing JSON text.
 *
 * @since 0.1.0
 */
public final class Json {

    private static final Parser sortedParser = Parser.builder().build();
    private static final Parser orderedParser =
            Parser.builder().preserveInsertionOrder(true).build();

    private Json() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Parse JSON text into a value. Objects sort their keys.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * JsonValue v = Json.parse("[1, 2.5, \"x\"]");
     * // -> JsonArray[JsonInteger, JsonDecimal, JsonString]
     * }</pre>
     *
     * @param json JSON text, not {@code null}
     * @return non-null value
     * @throws JsonException.SyntaxException if {@code json} is malformed
     */
    public static JsonValue parse(String json) {
        return sortedParser.parse(json);
    }

    /**
     * Parse JSON text whose top-level value is an object. Keys are sorted.
     *
     * @throws JsonException.SyntaxException        if {@code json} is malformed
     * @throws JsonException.BadConversionException if the top-level value is not an object
     */
    public static JsonObject parseObject(String json) {
        return parseObject(json, false);
    }

    /**
     * Parse JSON text whose top-level value is an object.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * JsonObject o = Json.parseObject("{\"b\":1,\"a\":2}", true);
     * o.getNames(); // -> [b, a]
     * }</pre>
     *
     * @param json                   JSON text, not {@code null}
     * @param preserveInsertionOrder whether every parsed object keeps its keys in document order
     */
    public static JsonObject parseObject(String json, boolean preserveInsertionOrder) {
        var parser = preserveInsertionOrder ? orderedParser : sortedParser;
        return parser.parse(json).convert(JsonObject.class);
    }

    /**
     * Parse JSON text whose top-level value is an array.
     *
     * @throws JsonException.SyntaxException        if {@code json} is malformed
     * @throws JsonException.BadConversionException if the top-level value is not an array
     */
    public static JsonArray parseArray(String json) {
        return sortedParser.parse(json).convert(JsonArray.class);
    }

    /**
     * Write a value as compact JSON text.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Json.stringify(new JsonObject().set("x", 42).set("y", 21));
     * // -> {"x":42,"y":21}
     * }</pre>
     *
     * @param value value, not {@code null}
     * @return non-null JSON text
     */
    public static String stringify(JsonValue value) {
        Objects.requireNonNull(value, "value");
        return Stringifier.condense(value);
    }

    /**
     * Write a value as JSON text.
     *
     * @param value  value, not {@code null}
     * @param indent indentation of the top-level members, 0 for compact output
     * @param step   indentation added per nesting level, negative for {@code indent}
     */
    public static String stringify(JsonValue value, int indent, int step) {
        Objects.requireNonNull(value, "value");
        var sb = new StringBuilder();
        Stringifier.stringify(value, sb, indent, step < 0 ? indent : step);
        return sb.toString();
    }
}
