package io.mydata.core.cast;

import io.mydata.core.error.TypeCastException;
import io.mydata.core.schema.Resource;
import io.mydata.core.schema.ResourceKind;
import io.mydata.core.spi.TypeCaster;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Built-in {@link TypeCaster} for the common primitive tags plus {@code resource}.
 *
 * <ul>
 *   <li>{@code string} → {@link String}
 *   <li>{@code integer} → {@link Long}
 *   <li>{@code decimal} → {@link BigDecimal}
 *   <li>{@code float} → {@link Double}
 *   <li>{@code boolean} → {@link Boolean}
 *   <li>{@code date} → {@link LocalDate} (ISO-8601)
 *   <li>{@code datetime} → {@link OffsetDateTime} (ISO-8601; values without an offset are read as UTC)
 *   <li>{@code resource} → a new {@link Resource} of the nested kind, from a map or by copying another instance
 * </ul>
 *
 * <p>{@code null} casts to {@code null} for every tag; blank strings cast to {@code null} for
 * every tag except {@code string}.
 *
 * <p>Thread-safe: stateless.
 */
public final class DefaultTypeCaster implements TypeCaster {

    public static final String STRING = "string";
    public static final String INTEGER = "integer";
    public static final String DECIMAL = "decimal";
    public static final String FLOAT = "float";
    public static final String BOOLEAN = "boolean";
    public static final String DATE = "date";
    public static final String DATETIME = "datetime";

    private static final Set<String> KNOWN_TYPES =
            Set.of(STRING, INTEGER, DECIMAL, FLOAT, BOOLEAN, DATE, DATETIME, RESOURCE);

    private static final Set<String> TRUE_WORDS = Set.of("true", "1", "yes", "y", "on");
    private static final Set<String> FALSE_WORDS = Set.of("false", "0", "no", "n", "off");

    @Override
    public boolean isKnownType(String type) {
        return type != null && KNOWN_TYPES.contains(type);
    }

    @Override
    public Object cast(Object value, String type, ResourceKind nestedKind) {
        if (value == null) {
            return null;
        }
        if (!STRING.equals(type) && value instanceof CharSequence text && text.toString().isBlank()) {
            return null;
        }
        return switch (type) {
            case STRING -> toStringValue(value);
            case INTEGER -> toInteger(value);
            case DECIMAL -> toDecimal(value);
            case FLOAT -> toFloat(value);
            case BOOLEAN -> toBoolean(value);
            case DATE -> toDate(value);
            case DATETIME -> toDateTime(value);
            case RESOURCE -> toResource(value, nestedKind);
            default -> throw new TypeCastException("Unknown type: " + type, type);
        };
    }

    private static String toStringValue(Object value) {
        if (value instanceof CharSequence || value instanceof Character || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Number || value instanceof TemporalAccessor || value instanceof Enum<?>) {
            return value.toString();
        }
        throw mismatch(value, STRING);
    }

    private static Long toInteger(Object value) {
        try {
            if (value instanceof Long l) {
                return l;
            }
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            if (value instanceof Number number) {
                return new BigDecimal(number.toString()).longValueExact();
            }
            if (value instanceof CharSequence text) {
                return new BigDecimal(text.toString().trim()).longValueExact();
            }
        } catch (NumberFormatException | ArithmeticException e) {
            throw new TypeCastException("Invalid integer: '" + value + "'", e, INTEGER);
        }
        throw mismatch(value, INTEGER);
    }

    private static BigDecimal toDecimal(Object value) {
        try {
            if (value instanceof BigDecimal decimal) {
                return decimal;
            }
            if (value instanceof BigInteger integer) {
                return new BigDecimal(integer);
            }
            if (value instanceof Double || value instanceof Float) {
                double d = ((Number) value).doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw new TypeCastException("Invalid decimal: '" + value + "'", DECIMAL);
                }
                return BigDecimal.valueOf(d);
            }
            if (value instanceof Number number) {
                return BigDecimal.valueOf(number.longValue());
            }
            if (value instanceof CharSequence text) {
                return new BigDecimal(text.toString().trim());
            }
        } catch (NumberFormatException e) {
            throw new TypeCastException("Invalid decimal: '" + value + "'", e, DECIMAL);
        }
        throw mismatch(value, DECIMAL);
    }

    private static Double toFloat(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof CharSequence text) {
            try {
                return Double.valueOf(text.toString().trim());
            } catch (NumberFormatException e) {
                throw new TypeCastException("Invalid float: '" + value + "'", e, FLOAT);
            }
        }
        throw mismatch(value, FLOAT);
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        String word = value instanceof Number || value instanceof CharSequence
                ? value.toString().trim().toLowerCase(Locale.ROOT)
                : null;
        if (word != null && TRUE_WORDS.contains(word)) {
            return Boolean.TRUE;
        }
        if (word != null && FALSE_WORDS.contains(word)) {
            return Boolean.FALSE;
        }
        throw new TypeCastException("Invalid boolean: '" + value + "'", BOOLEAN);
    }

    private static LocalDate toDate(Object value) {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof ZonedDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof CharSequence text) {
            try {
                return LocalDate.parse(text.toString().trim());
            } catch (DateTimeParseException e) {
                throw new TypeCastException("Invalid date: '" + value + "'", e, DATE);
            }
        }
        throw mismatch(value, DATE);
    }

    private static OffsetDateTime toDateTime(Object value) {
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime;
        }
        if (value instanceof ZonedDateTime dateTime) {
            return dateTime.toOffsetDateTime();
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.atOffset(ZoneOffset.UTC);
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        if (value instanceof CharSequence text) {
            String s = text.toString().trim();
            try {
                return OffsetDateTime.parse(s);
            } catch (DateTimeParseException withoutOffset) {
                try {
                    return LocalDateTime.parse(s).atOffset(ZoneOffset.UTC);
                } catch (DateTimeParseException e) {
                    throw new TypeCastException("Invalid datetime: '" + value + "'", e, DATETIME);
                }
            }
        }
        throw mismatch(value, DATETIME);
    }

    private static Resource toResource(Object value, ResourceKind nestedKind) {
        if (nestedKind == null) {
            throw new TypeCastException("No nested kind given for a resource value", RESOURCE);
        }
        if (value instanceof Resource resource) {
            return nestedKind.newInstance(resource);
        }
        if (value instanceof Map<?, ?> map) {
            return nestedKind.newInstance(map);
        }
        throw new TypeCastException(
                "Expected a map or " + nestedKind.name() + " instance but got " + value.getClass().getSimpleName(),
                RESOURCE);
    }

    private static TypeCastException mismatch(Object value, String type) {
        return new TypeCastException("Cannot cast " + value.getClass().getSimpleName() + " to " + type, type);
    }
}
