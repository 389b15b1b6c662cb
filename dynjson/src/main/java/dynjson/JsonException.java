package dynjson;

/**
 * Exception thrown when JSON parsing, serialization, or value conversion fails.
 * This is the base exception for all dynjson errors.
 *
 * @since 0.1.0
 */
public class JsonException extends RuntimeException {

    /**
     * Constructs a new JsonException with the specified detail message.
     *
     * @param message the detail message
     */
    public JsonException(String message) {
        super(message);
    }

    /**
     * Constructs a new JsonException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Exception thrown when JSON parsing fails due to malformed JSON syntax.
     */
    public static class SyntaxException extends JsonException {
        private final int line;
        private final int column;

        public SyntaxException(String message, int line, int column) {
            super(String.format("%s at line %d, column %d", message, line, column));
            this.line = line;
            this.column = column;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }
    }

    /**
     * Exception thrown during JSON serialization.
     *
     * <p> Raised for values JSON cannot represent (NaN, infinities) and for failures of the output sink.
     */
    public static class WriteException extends JsonException {
        public WriteException(String message) {
            super(message);
        }

        public WriteException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Base class of the failures raised when a {@link JsonValue} cannot produce a requested type.
     */
    public abstract static class ConversionException extends JsonException {
        private final JsonType sourceType;
        private final Class<?> targetType;

        protected ConversionException(String message, JsonType sourceType, Class<?> targetType) {
            super(message);
            this.sourceType = sourceType;
            this.targetType = targetType;
        }

        protected ConversionException(String message, JsonType sourceType, Class<?> targetType, Throwable cause) {
            super(message, cause);
            this.sourceType = sourceType;
            this.targetType = targetType;
        }

        public JsonType getSourceType() {
            return sourceType;
        }

        public Class<?> getTargetType() {
            return targetType;
        }
    }

    /**
     * The held kind has no conversion to the target type, or the held value does not fit it.
     */
    public static class BadConversionException extends ConversionException {
        public BadConversionException(String message, JsonType sourceType, Class<?> targetType) {
            super(message, sourceType, targetType);
        }

        public BadConversionException(String message, JsonType sourceType, Class<?> targetType, Throwable cause) {
            super(message, sourceType, targetType, cause);
        }
    }

    /**
     * The conversion is deliberately unsupported for now, e.g. a JSON object to a point in time.
     */
    public static class NotImplementedConversionException extends ConversionException {
        public NotImplementedConversionException(JsonType sourceType, Class<?> targetType) {
            super(
                    "Conversion not implemented: " + sourceType + " => " + targetType.getSimpleName(),
                    sourceType,
                    targetType);
        }
    }
}
