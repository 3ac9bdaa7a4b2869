package ini;

import lombok.NonNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Conversion of stored string values to scalar types.
 * <p>
 * Apart from {@link String}, a value converts only when the whole trimmed text is consumed:
 * {@code "42"} is an {@code Integer}, {@code "42x"} is not. Failures yield an empty result.
 */
public final class IniValues {

    private static final Pattern INTEGRAL = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Map<Class<?>, Function<String, ?>> CONVERTERS = new HashMap<>();

    static {
        register(Boolean.class, boolean.class, IniValues::toBoolean);
        register(Character.class, char.class, s -> s.length() == 1 ? s.charAt(0) : null);
        register(Byte.class, byte.class, s -> integral(s, Byte::valueOf));
        register(Short.class, short.class, s -> integral(s, Short::valueOf));
        register(Integer.class, int.class, s -> integral(s, Integer::valueOf));
        register(Long.class, long.class, s -> integral(s, Long::valueOf));
        register(Float.class, float.class, s -> finite(decimal(s, Float::valueOf)));
        register(Double.class, double.class, s -> finite(decimal(s, Double::valueOf)));
        CONVERTERS.put(BigInteger.class, s -> integral(s, BigInteger::new));
        CONVERTERS.put(BigDecimal.class, s -> decimal(s, BigDecimal::new));
    }

    private IniValues() {
    }

    /**
     * Converts {@code value} to {@code type}. Primitive types are treated as their wrappers.
     *
     * @return the converted value, empty when the value is {@code null}, malformed, out of range
     * or the type is not supported
     */
    @SuppressWarnings("unchecked")
    public static <T> Optional<T> extract(String value, @NonNull Class<T> type) {
        if (value == null) {
            return Optional.empty();
        }
        if (type == String.class) {
            return Optional.of((T) value);
        }
        Function<String, ?> converter = CONVERTERS.get(type);
        if (converter == null) {
            return Optional.empty();
        }
        String trimmed = IniText.trim(value);
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable((T) converter.apply(trimmed));
    }

    private static <T> void register(Class<T> boxed, Class<T> primitive, Function<String, T> converter) {
        CONVERTERS.put(boxed, converter);
        CONVERTERS.put(primitive, converter);
    }

    private static Boolean toBoolean(String s) {
        if ("true".equals(s)) {
            return Boolean.TRUE;
        }
        if ("false".equals(s)) {
            return Boolean.FALSE;
        }
        return null;
    }

    private static <T> T integral(String s, Function<String, T> parser) {
        return INTEGRAL.matcher(s).matches() ? parse(s, parser) : null;
    }

    private static <T> T decimal(String s, Function<String, T> parser) {
        return DECIMAL.matcher(s).matches() ? parse(s, parser) : null;
    }

    private static <T extends Number> T finite(T number) {
        return number == null || Double.isInfinite(number.doubleValue()) ? null : number;
    }

    private static <T> T parse(String s, Function<String, T> parser) {
        try {
            return parser.apply(s);
        } catch (NumberFormatException e) {
            // out of range for the target type
            return null;
        }
    }
}
