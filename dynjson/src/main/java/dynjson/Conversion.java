package dynjson;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of converting a {@link JsonValue} to a Java type: either the converted value or the reason it failed.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Conversion<Integer> c = new JsonString("42").tryConvert(Integer.class);
 * int n = c.orElse(0);
 * // -> 42
 * }</pre>
 *
 * @param <T> target type
 * @since 0.1.0
 */
public sealed interface Conversion<T> permits Conversion.Success, Conversion.Failure {

    static <T> Conversion<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Conversion<T> failure(JsonException.ConversionException error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    /**
     * Returns the converted value.
     *
     * @throws JsonException.ConversionException if the conversion failed
     */
    T get();

    /**
     * Returns the converted value, or {@code other} if the conversion failed.
     */
    @Nullable
    T orElse(@Nullable T other);

    /**
     * Returns the failure, or {@code null} on success.
     */
    JsonException.@Nullable ConversionException failure();

    default T orElseThrow() {
        return get();
    }

    record Success<T>(T value) implements Conversion<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T get() {
            return value;
        }

        @Override
        public T orElse(@Nullable T other) {
            return value;
        }

        @Override
        public JsonException.@Nullable ConversionException failure() {
            return null;
        }
    }

    record Failure<T>(JsonException.ConversionException error) implements Conversion<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T get() {
            throw error;
        }

        @Override
        public @Nullable T orElse(@Nullable T other) {
            return other;
        }

        @Override
        public JsonException.ConversionException failure() {
            return error;
        }
    }
}
