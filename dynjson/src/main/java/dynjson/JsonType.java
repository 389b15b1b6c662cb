package dynjson;

/**
 * Kind of payload held by a {@link JsonValue}.
 *
 * @since 0.1.0
 */
public enum JsonType {
    /**
     * The empty value, rendered as JSON {@code null}.
     */
    NULL,
    BOOLEAN,
    /**
     * Integral number stored as a {@code long}.
     */
    INTEGER,
    /**
     * Floating-point number stored as a {@code double}.
     */
    DECIMAL,
    STRING,
    ARRAY,
    OBJECT
}
