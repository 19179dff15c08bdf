package com.conversio.funnel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/**
 * Single property condition. {@code value} may be a scalar or, for {@link Operator#EXACT} and
 * {@link Operator#IS_NOT}, a list of alternatives.
 */
public record PropertyFilter(String key, Object value, Operator operator, Scope scope) {

    public PropertyFilter {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("property filter key is required");
        }
        operator = operator == null ? Operator.EXACT : operator;
        scope = scope == null ? Scope.EVENT : scope;
    }

    public static PropertyFilter exact(String key, Object value) {
        return new PropertyFilter(key, value, Operator.EXACT, Scope.EVENT);
    }

    public static PropertyFilter person(String key, Object value, Operator operator) {
        return new PropertyFilter(key, value, operator, Scope.PERSON);
    }

    public enum Operator {
        EXACT,
        IS_NOT,
        ICONTAINS,
        NOT_ICONTAINS,
        REGEX,
        NOT_REGEX,
        GT,
        GTE,
        LT,
        LTE,
        IS_SET,
        IS_NOT_SET;

        @JsonCreator
        public static Operator fromConfigValue(String value) {
            if (value == null || value.isBlank()) {
                return EXACT;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "exact", "eq" -> EXACT;
                case "is_not", "neq" -> IS_NOT;
                case "icontains" -> ICONTAINS;
                case "not_icontains" -> NOT_ICONTAINS;
                case "regex" -> REGEX;
                case "not_regex" -> NOT_REGEX;
                case "gt" -> GT;
                case "gte" -> GTE;
                case "lt" -> LT;
                case "lte" -> LTE;
                case "is_set" -> IS_SET;
                case "is_not_set" -> IS_NOT_SET;
                default -> throw new IllegalArgumentException("Unsupported property operator: " + value);
            };
        }
    }

    public enum Scope {
        EVENT,
        PERSON;

        @JsonCreator
        public static Scope fromConfigValue(String value) {
            if (value == null || value.isBlank()) {
                return EVENT;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "event" -> EVENT;
                case "person" -> PERSON;
                default -> throw new IllegalArgumentException("Unsupported property scope: " + value);
            };
        }
    }
}
