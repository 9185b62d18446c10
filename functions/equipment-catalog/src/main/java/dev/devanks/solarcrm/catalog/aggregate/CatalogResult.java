package dev.devanks.solarcrm.catalog.aggregate;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.function.Function;

/**
 * Outcome of an aggregate mutation: the new value, or the violation that prevented it.
 */
@EqualsAndHashCode
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CatalogResult<T> {

    private final T value;
    private final CatalogViolation violation;

    public static <T> CatalogResult<T> success(T value) {
        return new CatalogResult<>(value, null);
    }

    public static <T> CatalogResult<T> failure(CatalogViolation violation) {
        return new CatalogResult<>(null, violation);
    }

    public static <T> CatalogResult<T> failure(ViolationType type, String message, String entityId) {
        return failure(CatalogViolation.of(type, message, entityId));
    }

    public boolean isSuccess() {
        return violation == null;
    }

    public boolean isFailure() {
        return violation != null;
    }

    /**
     * @throws IllegalStateException if this is a failure
     */
    public T getValue() {
        if (violation != null) {
            throw new IllegalStateException("No value on failed result: " + violation.getMessage());
        }
        return value;
    }

    /**
     * @throws IllegalStateException if this is a success
     */
    public CatalogViolation getViolation() {
        if (violation == null) {
            throw new IllegalStateException("No violation on successful result");
        }
        return violation;
    }

    public <R> CatalogResult<R> map(Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(violation);
    }
}
