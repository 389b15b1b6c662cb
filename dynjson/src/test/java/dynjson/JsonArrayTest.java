package dynjson;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class JsonArrayTest {

    @Test
    void get_outOfRange_returnsNull() {
        var a = JsonArray.of(1);

        assertThat(a.get(-1)).isEqualTo(JsonNull.INSTANCE);
        assertThat(a.get(1)).isEqualTo(JsonNull.INSTANCE);
        assertThat(a.isNull(5)).isTrue();
        assertThat(a.getObject(5)).isNull();
    }

    @Test
    void typedAccessors() {
        var nested = new JsonObject();
        var a = new JsonArray().add("12").add(nested).add(new JsonArray()).add((Object) null);

        assertThat(a.getValue(0, Integer.class)).isEqualTo(12);
        assertThat(a.getObject(1)).isSameAs(nested);
        assertThat(a.getArray(2)).isNotNull();
        assertThat(a.getArray(0)).isNull();
        assertThat(a.isObject(1)).isTrue();
        assertThat(a.isArray(2)).isTrue();
        assertThat(a.isNull(3)).isTrue();
        assertThat(a.optValue(1, 5)).isEqualTo(5);
        assertThat(a.optValue(0, 5)).isEqualTo(12);
        assertThat(a.optValue(3, "dflt")).isEqualTo("dflt");
        assertThatThrownBy(() -> a.getValue(1, Integer.class))
                .isInstanceOf(JsonException.BadConversionException.class);
    }

    @Test
    void set_padsWithNull() {
        var a = new JsonArray().set(2, "x");

        assertThat(a.size()).isEqualTo(3);
        assertThat(a.stringify()).isEqualTo("[null,null,\"x\"]");
        assertThatThrownBy(() -> a.set(-1, 1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void remove() {
        var a = JsonArray.of("a", "b", "c");
        a.remove(1);
        a.remove(10);

        assertThat(a).containsExactly(new JsonString("a"), new JsonString("c"));
    }

    @Test
    void stringify_compactAndPretty() {
        var a = JsonArray.of(1, new JsonObject().set("k", "v"));

        assertThat(a.stringify()).isEqualTo("[1,{\"k\":\"v\"}]");
        assertThat(a.stringify(2)).isEqualTo("[\n  1,\n  {\n    \"k\" : \"v\"\n  }\n]");
        assertThat(new JsonArray().stringify()).isEqualTo("[]");
    }

    @Test
    void objectInsideArrayInsideObject_indentsConsistently() {
        var o = new JsonObject().set("a", JsonArray.of(new JsonObject().set("b", 1)));

        assertThat(o.stringify(2))
                .isEqualTo("{\n"
                        + "  \"a\" : [\n"
                        + "    {\n"
                        + "      \"b\" : 1\n"
                        + "    }\n"
                        + "  ]\n"
                        + "}");
    }

    @Test
    void deepCopy_isIndependent() {
        var inner = JsonArray.of(1);
        var a = new JsonArray().add(inner);
        var shallow = a.copy();
        var deep = a.deepCopy();

        inner.add(2);

        assertThat(shallow.getArray(0).size()).isEqualTo(2);
        assertThat(deep.getArray(0).size()).isEqualTo(1);
    }

    @Test
    void convert() {
        assertThat(new JsonArray().convert(Boolean.class)).isFalse();
        assertThat(JsonArray.of(true).convert(String.class)).isEqualTo("[\n  true\n]");
        assertThatThrownBy(() -> JsonArray.of(1).convert(Long.class))
                .isInstanceOf(JsonException.BadConversionException.class);
    }

    @Test
    void unwritableElement_convertsToFailureNotException() {
        var a = new JsonArray().add(JsonArray.of(Double.POSITIVE_INFINITY));

        assertThat(a.optValue(0, String.class, "dflt")).isEqualTo("dflt");
        assertThat(a.get(0).tryConvert(String.class).failure())
                .isInstanceOf(JsonException.BadConversionException.class)
                .hasCauseInstanceOf(JsonException.WriteException.class);
    }
}
