package dynjson;

import com.google.protobuf.ListValue;
import com.google.protobuf.ListValueOrBuilder;
import com.google.protobuf.NullValue;
import com.google.protobuf.Struct;
import com.google.protobuf.StructOrBuilder;
import com.google.protobuf.Value;
import com.google.protobuf.ValueOrBuilder;

/**
 * Converts between dynjson values and Protocol Buffers' JSON model ({@link Struct}, {@link ListValue},
 * {@link Value}).
 *
 * <p> {@code protobuf-java} is an optional dependency; check {@link #isAvailable()} before calling anything else.
 *
 * <p> Protobuf numbers are doubles. Integral doubles within ±2<sup>53</sup> come back as {@link JsonInteger}, other
 * numbers as {@link JsonDecimal}.
 *
 * @since 0.1.0
 */
public final class StructCodec {

    private static final boolean PROTOBUF_PRESENT = isClassPresent("com.google.protobuf.Struct");

    // largest magnitude below which every integer is exactly representable as a double
    private static final double MAX_EXACT_INTEGER = 9007199254740992d;

    private static final long NEGATIVE_ZERO_BITS = Double.doubleToRawLongBits(-0.0);

    private StructCodec() {
        throw new UnsupportedOperationException();
    }

    public static boolean isAvailable() {
        return PROTOBUF_PRESENT;
    }

    public static Value toValue(JsonValue value) {
        var builder = Value.newBuilder();
        if (value instanceof JsonNull) builder.setNullValue(NullValue.NULL_VALUE);
        else if (value instanceof JsonBoolean b) builder.setBoolValue(b.value());
        else if (value instanceof JsonInteger i) builder.setNumberValue(i.value());
        else if (value instanceof JsonDecimal d) builder.setNumberValue(d.value());
        else if (value instanceof JsonString s) builder.setStringValue(s.value());
        else if (value instanceof JsonObject o) builder.setStructValue(toStruct(o));
        else if (value instanceof JsonArray a) builder.setListValue(toListValue(a));
        return builder.build();
    }

    public static Struct toStruct(JsonObject object) {
        var builder = Struct.newBuilder();
        for (var entry : object) builder.putFields(entry.getKey(), toValue(entry.getValue()));
        return builder.build();
    }

    public static ListValue toListValue(JsonArray array) {
        var builder = ListValue.newBuilder();
        for (var v : array) builder.addValues(toValue(v));
        return builder.build();
    }

    public static JsonValue fromValue(ValueOrBuilder value) {
        return fromValue(value, false);
    }

    /**
     * @param preserveInsertionOrder ordering mode of the objects created for nested structs
     */
    public static JsonValue fromValue(ValueOrBuilder value, boolean preserveInsertionOrder) {
        return switch (value.getKindCase()) {
            case NULL_VALUE, KIND_NOT_SET -> JsonNull.INSTANCE;
            case NUMBER_VALUE -> fromNumber(value.getNumberValue());
            case STRING_VALUE -> new JsonString(value.getStringValue());
            case BOOL_VALUE -> JsonBoolean.of(value.getBoolValue());
            case STRUCT_VALUE -> fromStruct(value.getStructValue(), preserveInsertionOrder);
            case LIST_VALUE -> fromListValue(value.getListValue(), preserveInsertionOrder);
        };
    }

    public static JsonObject fromStruct(StructOrBuilder struct, boolean preserveInsertionOrder) {
        var object = new JsonObject(preserveInsertionOrder);
        for (var entry : struct.getFieldsMap().entrySet()) {
            object.set(entry.getKey(), fromValue(entry.getValue(), preserveInsertionOrder));
        }
        return object;
    }

    public static JsonArray fromListValue(ListValueOrBuilder list) {
        return fromListValue(list, false);
    }

    public static JsonArray fromListValue(ListValueOrBuilder list, boolean preserveInsertionOrder) {
        var array = new JsonArray();
        for (Value v : list.getValuesList()) array.add(fromValue(v, preserveInsertionOrder));
        return array;
    }

    static JsonValue fromNumber(double d) {
        // -0.0 stays a decimal so the sign survives
        boolean negativeZero = Double.doubleToRawLongBits(d) == NEGATIVE_ZERO_BITS;
        if (!negativeZero && Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) <= MAX_EXACT_INTEGER) {
            return new JsonInteger((long) d);
        }
        return new JsonDecimal(d);
    }

    static boolean isClassPresent(String name) {
        try {
            Class.forName(name);
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }
}
