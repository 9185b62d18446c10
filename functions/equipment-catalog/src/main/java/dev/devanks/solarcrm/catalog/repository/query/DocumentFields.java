package dev.devanks.solarcrm.catalog.repository.query;

import dev.devanks.solarcrm.catalog.model.SortDirection;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.springframework.beans.BeanWrapper;
import org.springframework.beans.PropertyAccessorFactory;

import java.util.Comparator;

/**
 * Reads document fields by bean property path ({@code "diodeModel.rs"}) and orders documents by them.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class DocumentFields {

    /**
     * @return the value, or {@code null} when the path is unknown or a nested value is {@code null}
     */
    public static Object read(Object document, String path) {
        if (document == null) {
            return null;
        }
        BeanWrapper wrapper = PropertyAccessorFactory.forBeanPropertyAccess(document);
        return wrapper.isReadableProperty(path) ? wrapper.getPropertyValue(path) : null;
    }

    /**
     * Comparator on one field. Documents without a value sort last in both directions.
     */
    public static <D> Comparator<D> comparator(String field, SortDirection direction) {
        Comparator<Object> values = DocumentFields::compare;
        if (direction == SortDirection.DESC) {
            values = values.reversed();
        }
        Comparator<Object> nullsLast = Comparator.nullsLast(values);
        return (left, right) -> nullsLast.compare(read(left, field), read(right, field));
    }

    @SuppressWarnings("unchecked")
    static int compare(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (left instanceof Comparable<?> && left.getClass().isInstance(right)) {
            return ((Comparable<Object>) left).compareTo(right);
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }
}
