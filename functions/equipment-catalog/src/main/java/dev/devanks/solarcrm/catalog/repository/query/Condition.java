package dev.devanks.solarcrm.catalog.repository.query;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Predicate on a single document field. The set of conditions is closed: equality, case-insensitive
 * pattern, closed range and missing value.
 */
public abstract class Condition {

    private Condition() {
    }

    /**
     * @param value field value, {@code null} when the field is absent or unreadable
     */
    public abstract boolean test(Object value);

    public static Condition eq(Object expected) {
        return new Equals(expected);
    }

    public static Condition pattern(String regex) {
        return new Pattern(regex);
    }

    public static Condition range(Object min, Object max) {
        return new Range(min, max);
    }

    public static Condition missing() {
        return Missing.INSTANCE;
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static final class Equals extends Condition {
        private final Object expected;

        private Equals(Object expected) {
            this.expected = expected;
        }

        @Override
        public boolean test(Object value) {
            if (value instanceof Number && expected instanceof Number) {
                return ((Number) value).doubleValue() == ((Number) expected).doubleValue();
            }
            if (value instanceof Enum<?> && expected instanceof String) {
                return ((Enum<?>) value).name().equals(expected);
            }
            return value != null && Objects.equals(value, expected);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false, of = "regex")
    @ToString(of = "regex")
    public static final class Pattern extends Condition {
        private final String regex;
        private final java.util.regex.Pattern compiled;

        private Pattern(String regex) {
            this.regex = Objects.requireNonNull(regex, "regex");
            this.compiled = java.util.regex.Pattern.compile(regex, java.util.regex.Pattern.CASE_INSENSITIVE
                    | java.util.regex.Pattern.UNICODE_CASE);
        }

        @Override
        public boolean test(Object value) {
            return value instanceof CharSequence && compiled.matcher((CharSequence) value).find();
        }
    }

    /**
     * Closed interval; a {@code null} bound is left open.
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static final class Range extends Condition {
        private final Object min;
        private final Object max;

        private Range(Object min, Object max) {
            this.min = min;
            this.max = max;
        }

        @Override
        public boolean test(Object value) {
            if (value == null) {
                return false;
            }
            return (min == null || DocumentFields.compare(value, min) >= 0)
                    && (max == null || DocumentFields.compare(value, max) <= 0);
        }
    }

    @ToString
    public static final class Missing extends Condition {
        private static final Missing INSTANCE = new Missing();

        private Missing() {
        }

        @Override
        public boolean test(Object value) {
            return value == null;
        }
    }
}
