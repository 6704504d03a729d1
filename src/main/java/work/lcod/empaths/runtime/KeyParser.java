package work.lcod.empaths.runtime;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses the textual key of a path hop into the key type used by a map.
 */
public final class KeyParser {
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Set<String> TRUE_LITERALS = Set.of("1", "t", "T", "TRUE", "true", "True");
    private static final Set<String> FALSE_LITERALS = Set.of("0", "f", "F", "FALSE", "false", "False");

    private KeyParser() {}

    /**
     * @return the parsed key, or empty when {@code raw} is not a valid literal of {@code keyType}
     */
    public static Optional<Object> parse(String raw, Class<?> keyType) {
        if (raw == null || keyType == null) {
            return Optional.empty();
        }
        if (keyType == String.class) {
            return Optional.of(raw);
        }
        try {
            if (keyType == Integer.class) {
                return Optional.of(Integer.parseInt(raw, 10));
            }
            if (keyType == Long.class) {
                return Optional.of(Long.parseLong(raw, 10));
            }
            if (keyType == Short.class) {
                return Optional.of(Short.parseShort(raw, 10));
            }
            if (keyType == Byte.class) {
                return Optional.of(Byte.parseByte(raw, 10));
            }
            if (keyType == BigInteger.class) {
                return Optional.of(new BigInteger(raw, 10));
            }
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
        if (keyType == Boolean.class) {
            return parseBoolean(raw);
        }
        if (keyType == Double.class) {
            return parseDouble(raw).map(d -> (Object) d);
        }
        if (keyType == Float.class) {
            return parseDouble(raw).map(d -> (Object) d.floatValue());
        }
        if (keyType == BigDecimal.class) {
            return DECIMAL.matcher(raw).matches() ? Optional.of(new BigDecimal(raw)) : Optional.empty();
        }
        if (keyType == Character.class) {
            return raw.length() == 1 ? Optional.of(raw.charAt(0)) : Optional.empty();
        }
        if (keyType.isEnum()) {
            return parseEnum(raw, keyType);
        }
        return Optional.empty();
    }

    private static Optional<Object> parseBoolean(String raw) {
        if (TRUE_LITERALS.contains(raw)) {
            return Optional.of(Boolean.TRUE);
        }
        if (FALSE_LITERALS.contains(raw)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    private static Optional<Double> parseDouble(String raw) {
        if (DECIMAL.matcher(raw).matches()) {
            return Optional.of(Double.parseDouble(raw));
        }
        var unsigned = raw.startsWith("+") || raw.startsWith("-") ? raw.substring(1) : raw;
        var negative = raw.startsWith("-");
        switch (unsigned.toLowerCase(Locale.ROOT)) {
            case "inf":
            case "infinity":
                return Optional.of(negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
            case "nan":
                return Optional.of(Double.NaN);
            default:
                return Optional.empty();
        }
    }

    private static Optional<Object> parseEnum(String raw, Class<?> keyType) {
        for (Object constant : keyType.getEnumConstants()) {
            if (((Enum<?>) constant).name().equals(raw)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }
}
