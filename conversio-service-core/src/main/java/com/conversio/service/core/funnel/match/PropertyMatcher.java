package com.conversio.service.core.funnel.match;

import com.conversio.event.model.ActorEvent;
import com.conversio.funnel.model.PropertyFilter;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Compiles {@link PropertyFilter}s into row predicates. */
public final class PropertyMatcher {

    private PropertyMatcher() {}

    public static Predicate<ActorEvent> compileAll(List<PropertyFilter> filters) {
        Predicate<ActorEvent> result = row -> true;
        for (PropertyFilter filter : filters) {
            result = result.and(compile(filter));
        }
        return result;
    }

    public static Predicate<ActorEvent> compile(PropertyFilter filter) {
        String key = filter.key();
        boolean person = filter.scope() == PropertyFilter.Scope.PERSON;
        Predicate<Object> valueTest = valuePredicate(filter);
        return row -> {
            boolean present = person ? row.personProperties().containsKey(key) : row.properties().containsKey(key);
            Object value = person ? row.personProperty(key) : row.property(key);
            return switch (filter.operator()) {
                case IS_SET -> present && value != null;
                case IS_NOT_SET -> !present || value == null;
                default -> valueTest.test(value);
            };
        };
    }

    private static Predicate<Object> valuePredicate(PropertyFilter filter) {
        Object expected = filter.value();
        return switch (filter.operator()) {
            case EXACT -> actual -> actual != null && anyEquals(expected, actual);
            case IS_NOT -> actual -> actual == null || !anyEquals(expected, actual);
            case ICONTAINS -> actual -> actual != null && containsIgnoreCase(actual, expected);
            case NOT_ICONTAINS -> actual -> actual == null || !containsIgnoreCase(actual, expected);
            case REGEX -> {
                Pattern pattern = pattern(filter);
                yield actual -> actual != null && pattern.matcher(normalize(actual)).find();
            }
            case NOT_REGEX -> {
                Pattern pattern = pattern(filter);
                yield actual -> actual == null || !pattern.matcher(normalize(actual)).find();
            }
            case GT -> actual -> compareNumeric(actual, expected, c -> c > 0);
            case GTE -> actual -> compareNumeric(actual, expected, c -> c >= 0);
            case LT -> actual -> compareNumeric(actual, expected, c -> c < 0);
            case LTE -> actual -> compareNumeric(actual, expected, c -> c <= 0);
            case IS_SET, IS_NOT_SET -> actual -> true;
        };
    }

    /** String form used for comparisons and breakdown values; numbers lose trailing zeros. */
    public static String normalize(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Number number) {
            BigDecimal decimal = toDecimal(number);
            return decimal == null ? number.toString() : decimal.stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    private static boolean anyEquals(Object expected, Object actual) {
        String normalized = normalize(actual);
        if (expected instanceof Collection<?> options) {
            return options.stream().anyMatch(option -> normalize(option).equals(normalized));
        }
        return normalize(expected).equals(normalized);
    }

    private static boolean containsIgnoreCase(Object actual, Object expected) {
        return normalize(actual).toLowerCase(Locale.ROOT).contains(normalize(expected).toLowerCase(Locale.ROOT));
    }

    private static Pattern pattern(PropertyFilter filter) {
        try {
            return Pattern.compile(normalize(filter.value()));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid regex for property " + filter.key() + ": " + filter.value(), e);
        }
    }

    private static boolean compareNumeric(Object actual, Object expected, Predicate<Integer> outcome) {
        BigDecimal left = parseDecimal(actual);
        BigDecimal right = parseDecimal(expected);
        if (left == null || right == null) {
            return false;
        }
        return outcome.test(left.compareTo(right));
    }

    private static BigDecimal parseDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return toDecimal(number);
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
