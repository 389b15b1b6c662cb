package dynjson;

import java.math.BigInteger;
import java.util.Objects;
import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses JSON text (RFC 8259) into {@link JsonValue}s.
 *
 * <p> Objects are populated through {@link JsonObject#set(String, JsonValue)}, so a repeated key keeps its first
 * position and its last value. Integral numbers that fit a {@code long} become {@link JsonInteger}, every other
 * number becomes {@link JsonDecimal}; numbers beyond the {@code double} range are rejected.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * var parser = Parser.builder().preserveInsertionOrder(true).build();
 * var o = (JsonObject) parser.parse("{\"b\":1,\"a\":[true,null]}");
 * o.getNames(); // -> [b, a]
 * }</pre>
 *
 * @since 0.1.0
 */
@Getter
@Builder(toBuilder = true)
public final class Parser {

    private static final Logger LOGGER = LoggerFactory.getLogger(Parser.class);

    public static final int DEFAULT_MAX_DEPTH = 1000;

    /**
     * Ordering mode of every object this parser creates.
     */
    @Builder.Default
    private final boolean preserveInsertionOrder = false;

    /**
     * Maximum nesting of arrays and objects.
     */
    @Builder.Default
    private final int maxDepth = DEFAULT_MAX_DEPTH;

    /**
     * Parse a complete JSON text.
     *
     * @param json JSON text, not {@code null}
     * @return the top-level value
     * @throws JsonException.SyntaxException if {@code json} is not valid JSON
     */
    public JsonValue parse(String json) {
        Objects.requireNonNull(json, "json");
        var in = new Cursor(json);
        JsonValue value = readValue(in, 0);
        in.skipWhitespace();
        if (!in.atEnd()) throw in.fail("Unexpected content after the top-level value");
        LOGGER.debug("Parsed {} from {} characters", value.type(), json.length());
        return value;
    }

    JsonValue readValue(Cursor in, int depth) {
        in.skipWhitespace();
        if (in.atEnd()) throw in.fail("Unexpected end of input, expected a value");
        char c = in.peek();
        return switch (c) {
            case '{' -> readObject(in, depth + 1);
            case '[' -> readArray(in, depth + 1);
            case '"' -> new JsonString(in.readString());
            case 't' -> in.literal("true", JsonBoolean.TRUE);
            case 'f' -> in.literal("false", JsonBoolean.FALSE);
            case 'n' -> in.literal("null", JsonNull.INSTANCE);
            default -> {
                if (c == '-' || Cursor.isDigit(c)) yield readNumber(in);
                throw in.fail("Unexpected character '" + c + "'");
            }
        };
    }

    JsonObject readObject(Cursor in, int depth) {
        checkDepth(in, depth);
        in.require('{', "Expected '{'");
        var object = new JsonObject(preserveInsertionOrder);
        in.skipWhitespace();
        if (in.consume('}')) return object;
        do {
            in.skipWhitespace();
            if (in.atEnd() || in.peek() != '"') throw in.fail("Expected a string key in object");
            String key = in.readString();
            in.skipWhitespace();
            in.require(':', "Expected ':' after object key");
            object.set(key, readValue(in, depth));
            in.skipWhitespace();
        } while (in.consume(','));
        in.require('}', "Expected ',' or '}' in object");
        return object;
    }

    JsonArray readArray(Cursor in, int depth) {
        checkDepth(in, depth);
        in.require('[', "Expected '['");
        var array = new JsonArray();
        in.skipWhitespace();
        if (in.consume(']')) return array;
        do {
            array.add(readValue(in, depth));
            in.skipWhitespace();
        } while (in.consume(','));
        in.require(']', "Expected ',' or ']' in array");
        return array;
    }

    /**
     * Reads a number. Integral lexemes within {@code long} range become {@link JsonInteger}.
     */
    static JsonValue readNumber(Cursor in) {
        int line = in.line, column = in.column, start = in.pos;
        boolean integral = true;
        in.consume('-');
        if (!in.consume('0') && in.skipDigits() == 0) throw in.fail("Expected a digit");
        if (in.consume('.')) {
            integral = false;
            if (in.skipDigits() == 0) throw in.fail("Expected a digit after the decimal point");
        }
        if (in.consume('e') || in.consume('E')) {
            integral = false;
            if (!in.consume('+')) in.consume('-');
            if (in.skipDigits() == 0) throw in.fail("Expected a digit in the exponent");
        }
        String lexeme = in.text.substring(start, in.pos);
        if (integral) {
            var big = new BigInteger(lexeme);
            if (big.bitLength() < Long.SIZE) return new JsonInteger(big.longValue());
        }
        double d = Double.parseDouble(lexeme);
        if (Double.isInfinite(d)) throw new JsonException.SyntaxException("Number out of range: " + lexeme, line, column);
        return new JsonDecimal(d);
    }

    private void checkDepth(Cursor in, int depth) {
        if (depth > maxDepth) throw in.fail("Maximum nesting depth of " + maxDepth + " exceeded");
    }

    /**
     * Read position over the JSON text. {@code column} is the 1-based column of the next unread character.
     */
    static final class Cursor {
        private final String text;
        private int pos;
        private int line = 1;
        private int column = 1;

        Cursor(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        char next() {
            column++;
            return text.charAt(pos++);
        }

        boolean consume(char expected) {
            if (atEnd() || peek() != expected) return false;
            next();
            return true;
        }

        void require(char expected, String message) {
            if (!consume(expected)) throw fail(message);
        }

        void skipWhitespace() {
            while (!atEnd()) {
                char c = peek();
                if (c == '\n') {
                    pos++;
                    line++;
                    column = 1;
                } else if (c == ' ' || c == '\t' || c == '\r') {
                    next();
                } else {
                    return;
                }
            }
        }

        int skipDigits() {
            int count = 0;
            while (!atEnd() && isDigit(peek())) {
                next();
                count++;
            }
            return count;
        }

        JsonValue literal(String word, JsonValue value) {
            if (!text.startsWith(word, pos)) throw fail("Invalid literal, expected '" + word + "'");
            pos += word.length();
            column += word.length();
            return value;
        }

        String readString() {
            require('"', "Expected '\"'");
            var sb = new StringBuilder();
            while (true) {
                if (atEnd()) throw fail("Unterminated string");
                char c = next();
                if (c == '"') return sb.toString();
                if (c == '\\') readEscape(sb);
                else if (c < 0x20) throw fail(String.format("Control character U+%04X must be escaped", (int) c));
                else sb.append(c);
            }
        }

        private void readEscape(StringBuilder sb) {
            if (atEnd()) throw fail("Unterminated string");
            char e = next();
            switch (e) {
                case '"', '\\', '/' -> sb.append(e);
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'u' -> readUnicodeEscape(sb);
                default -> throw fail("Invalid escape '\\" + e + "'");
            }
        }

        // a high surrogate needs a second escape holding the low half
        private void readUnicodeEscape(StringBuilder sb) {
            char high = readHexChar();
            if (Character.isLowSurrogate(high)) throw fail("Unpaired low surrogate in \\u escape");
            if (!Character.isHighSurrogate(high)) {
                sb.append(high);
                return;
            }
            if (!text.startsWith("\\u", pos)) throw fail("Unpaired high surrogate in \\u escape");
            pos += 2;
            column += 2;
            char low = readHexChar();
            if (!Character.isLowSurrogate(low)) throw fail("Invalid low surrogate in \\u escape");
            sb.append(high).append(low);
        }

        private char readHexChar() {
            int value = 0;
            for (int k = 0; k < 4; k++) {
                int digit = atEnd() ? -1 : hexDigit(next());
                if (digit < 0) throw fail("Expected 4 hex digits after \\u");
                value = (value << 4) | digit;
            }
            return (char) value;
        }

        JsonException.SyntaxException fail(String message) {
            return new JsonException.SyntaxException(message, line, column);
        }

        static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private static int hexDigit(char c) {
            if (isDigit(c)) return c - '0';
            if (c >= 'a' && c <= 'f') return c - 'a' + 10;
            if (c >= 'A' && c <= 'F') return c - 'A' + 10;
            return -1;
        }
    }
}
