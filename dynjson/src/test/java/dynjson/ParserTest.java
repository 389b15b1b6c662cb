package dynjson;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.stream.IntStream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

class ParserTest {

    @Nested
    class ValueTests {

        @Test
        void scalars() {
            // @spotless:off
            var table = new Object[][] {
                    {"null", JsonNull.INSTANCE},
                    {"true", JsonBoolean.TRUE},
                    {" false ", JsonBoolean.FALSE},
                    {"0", new JsonInteger(0)},
                    {"-0", new JsonInteger(0)},
                    {"42", new JsonInteger(42)},
                    {"-9223372036854775808", new JsonInteger(Long.MIN_VALUE)},
                    {"9223372036854775808", new JsonDecimal(9.223372036854775808E18)},
                    {"1.0", new JsonDecimal(1.0)},
                    {"1e2", new JsonDecimal(100.0)},
                    {"-2.5E-1", new JsonDecimal(-0.25)},
                    {"1e308", new JsonDecimal(1e308)},
                    {"1e-999", new JsonDecimal(0.0)},
                    {"\"\"", new JsonString("")},
                    {"\"a\\\"b\\\\c\\/d\"", new JsonString("a\"b\\c/d")},
                    {"\"\\b\\f\\n\\r\\t\"", new JsonString("\b\f\n\r\t")},
                    {"\"\\u00e9\"", new JsonString("é")},
                    {"\"\\uD83D\\uDE00\"", new JsonString("😀")},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                assertThat(Json.parse((String) row[0])).as("Case %d: %s", i, row[0]).isEqualTo(row[1]);
            }));
        }

        @Test
        void sortedByDefault() {
            var o = (JsonObject) Json.parse("{\"b\":1,\"a\":{\"d\":1,\"c\":2}}");

            assertThat(o.getNames()).containsExactly("a", "b");
            assertThat(o.getObject("a").getNames()).containsExactly("c", "d");
            assertThat(o.isPreserveInsertionOrder()).isFalse();
        }

        @Test
        void preserveInsertionOrder_appliesToNestedObjects() {
            var parser = Parser.builder().preserveInsertionOrder(true).build();
            var o = (JsonObject) parser.parse("{\"b\":1,\"a\":[{\"d\":1,\"c\":2}]}");

            assertThat(o.getNames()).containsExactly("b", "a");
            assertThat(o.getArray("a").getObject(0).getNames()).containsExactly("d", "c");
        }

        @Test
        void duplicateKey_lastValueWins_firstPositionKept() {
            var o = Json.parseObject("{\"b\":1,\"a\":2,\"b\":3}", true);

            assertThat(o.getNames()).containsExactly("b", "a");
            assertThat(o.get("b")).isEqualTo(new JsonInteger(3));
        }

        @Test
        void emptyContainers() {
            assertThat(Json.parse("{ }")).isEqualTo(new JsonObject());
            assertThat(Json.parse("[\n]")).isEqualTo(new JsonArray());
        }

        @Test
        void builderDefaults() {
            var parser = Parser.builder().build();

            assertThat(parser.isPreserveInsertionOrder()).isFalse();
            assertThat(parser.getMaxDepth()).isEqualTo(Parser.DEFAULT_MAX_DEPTH);
            assertThat(parser.toBuilder().maxDepth(3).build().getMaxDepth()).isEqualTo(3);
        }
    }

    @Nested
    class ErrorTests {

        @Test
        void syntaxException() {
            // @spotless:off
            var table = new Object[][] {
                    {"", "Unexpected end of input, expected a value at line 1, column 1"},
                    {"\"1.5", "Unterminated string at line 1, column 5"},
                    {"nul", "Invalid literal, expected 'null' at line 1, column 1"},
                    {"tru", "Invalid literal, expected 'true' at line 1, column 1"},
                    {"false,", "Unexpected content after the top-level value at line 1, column 6"},
                    {"1,2", "Unexpected content after the top-level value at line 1, column 2"},
                    {"{x:1}", "Expected a string key in object at line 1, column 2"},
                    {"{1:2}", "Expected a string key in object at line 1, column 2"},
                    {"{\"x\" 1}", "Expected ':' after object key at line 1, column 6"},
                    {"{\"x\":1", "Expected ',' or '}' in object at line 1, column 7"},
                    {"[1,2", "Expected ',' or ']' in array at line 1, column 5"},
                    {"[1 2]", "Expected ',' or ']' in array at line 1, column 4"},
                    {"[1,]", "Unexpected character ']' at line 1, column 4"},
                    {"01", "Unexpected content after the top-level value at line 1, column 2"},
                    {"-", "Expected a digit at line 1, column 2"},
                    {"1.", "Expected a digit after the decimal point"},
                    {"1e", "Expected a digit in the exponent"},
                    {"1e999", "Number out of range: 1e999 at line 1, column 1"},
                    {"[-1E400]", "Number out of range: -1E400 at line 1, column 2"},
                    {"\"\\x\"", "Invalid escape '\\x'"},
                    {"\"\\u12G4\"", "Expected 4 hex digits after \\u"},
                    {"\"\\uD83D\"", "Unpaired high surrogate"},
                    {"\"\\uD83D", "Unpaired high surrogate"},
                    {"\"\\uD83D\\u0041\"", "Invalid low surrogate"},
                    {"\"\\uDE00\"", "Unpaired low surrogate"},
                    {"\"a\001\"", "Control character U+0001 must be escaped"},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                var input = (String) row[0];
                assertThatCode(() -> Json.parse(input))
                        .as("Case %d: input=%s", i, input)
                        .isInstanceOf(JsonException.SyntaxException.class)
                        .hasMessageContaining((String) row[1]);
            }));
        }

        @Test
        void syntaxException_reportsLine() {
            var e = assertThrows(
                    JsonException.SyntaxException.class, () -> Json.parse("{\n  \"a\": ?\n}"));

            assertThat(e.getLine()).isEqualTo(2);
            assertThat(e.getColumn()).isEqualTo(8);
        }

        @Test
        void maxDepth() {
            var parser = Parser.builder().maxDepth(2).build();

            assertThat(parser.parse("[[1]]")).isEqualTo(JsonArray.of(JsonArray.of(1)));
            assertThatCode(() -> parser.parse("[[[1]]]"))
                    .isInstanceOf(JsonException.SyntaxException.class)
                    .hasMessageContaining("Maximum nesting depth of 2 exceeded");
            assertThatCode(() -> parser.parse("{\"a\":{\"b\":{}}}"))
                    .isInstanceOf(JsonException.SyntaxException.class);
        }

        @Test
        void defaultMaxDepth_stopsRunawayNesting() {
            var deep = "[".repeat(Parser.DEFAULT_MAX_DEPTH + 1) + "]".repeat(Parser.DEFAULT_MAX_DEPTH + 1);
            var ok = "[".repeat(Parser.DEFAULT_MAX_DEPTH) + "]".repeat(Parser.DEFAULT_MAX_DEPTH);

            assertThatCode(() -> Json.parse(deep)).isInstanceOf(JsonException.SyntaxException.class);
            assertThatCode(() -> Json.parse(ok)).doesNotThrowAnyException();
        }
    }

    @Test
    void output_isReadByJacksonAsTheSameTree() {
        var mapper = JsonMapper.builder().build();
        // @spotless:off
        var inputs = new String[] {
                "{\"name\":\"Freeman\",\"tags\":[\"a\",\"b\"],\"age\":25,\"score\":9.5,\"ok\":true,\"x\":null}",
                "[1,-2,3.25,\"\\u0001\\n\\\"\",{\"nested\":{\"deep\":[[],{}]}}]",
                "{\"unicode\":\"caf\\u00e9 \\uD83D\\uDE00\",\"key \\\"quoted\\\"\":0}",
        };
        // @spotless:on

        assertAll(IntStream.range(0, inputs.length).mapToObj(i -> () -> {
            var input = inputs[i];
            var value = Json.parse(input);
            assertThat(mapper.readTree(Json.stringify(value)))
                    .as("Case %d compact", i)
                    .isEqualTo(mapper.readTree(input));
            assertThat(mapper.readTree(Json.stringify(value, 2, 2)))
                    .as("Case %d pretty", i)
                    .isEqualTo(mapper.readTree(input));
        }));
    }
}
