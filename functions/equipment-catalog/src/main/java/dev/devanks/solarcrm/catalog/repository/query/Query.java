package dev.devanks.solarcrm.catalog.repository.query;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable query fragment evaluated against documents in memory.
 * <p>
 * A document matches when every field condition holds, at least one member of the {@code anyOf} group
 * matches (if the group is present) and every member of the {@code allOf} group matches.
 */
@EqualsAndHashCode
public final class Query {

    private static final Query EMPTY = new Query(Map.of(), List.of(), List.of());

    private final Map<String, Condition> fields;
    private final List<Query> anyOf;
    private final List<Query> allOf;

    private Query(Map<String, Condition> fields, List<Query> anyOf, List<Query> allOf) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.anyOf = List.copyOf(anyOf);
        this.allOf = List.copyOf(allOf);
    }

    public static Query empty() {
        return EMPTY;
    }

    public static Query where(String field, Condition condition) {
        return new Query(Map.of(field, condition), List.of(), List.of());
    }

    public static Query fields(Map<String, Condition> fields) {
        return fields.isEmpty() ? EMPTY : new Query(fields, List.of(), List.of());
    }

    public static Query anyOf(Query... alternatives) {
        return anyOf(Arrays.asList(alternatives));
    }

    public static Query anyOf(List<Query> alternatives) {
        return alternatives.isEmpty() ? EMPTY : new Query(Map.of(), alternatives, List.of());
    }

    public static Query allOf(Query... parts) {
        return allOf(Arrays.asList(parts));
    }

    public static Query allOf(List<Query> parts) {
        return parts.isEmpty() ? EMPTY : new Query(Map.of(), List.of(), parts);
    }

    static Query of(Map<String, Condition> fields, List<Query> anyOf, List<Query> allOf) {
        if (fields.isEmpty() && anyOf.isEmpty() && allOf.isEmpty()) {
            return EMPTY;
        }
        return new Query(fields, anyOf, allOf);
    }

    /**
     * Returns a copy with one more field condition. An existing condition on the same field is replaced.
     */
    public Query and(String field, Condition condition) {
        var merged = new LinkedHashMap<>(fields);
        merged.put(field, condition);
        return new Query(merged, anyOf, allOf);
    }

    public Map<String, Condition> getFields() {
        return fields;
    }

    public List<Query> getAnyOf() {
        return anyOf;
    }

    public List<Query> getAllOf() {
        return allOf;
    }

    public boolean hasAnyOf() {
        return !anyOf.isEmpty();
    }

    public boolean isEmpty() {
        return fields.isEmpty() && anyOf.isEmpty() && allOf.isEmpty();
    }

    public boolean matches(Object document) {
        for (Map.Entry<String, Condition> entry : fields.entrySet()) {
            if (!entry.getValue().test(DocumentFields.read(document, entry.getKey()))) {
                return false;
            }
        }
        if (hasAnyOf() && anyOf.stream().noneMatch(alternative -> alternative.matches(document))) {
            return false;
        }
        return allOf.stream().allMatch(part -> part.matches(document));
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        fields.forEach((field, condition) -> parts.add(field + " " + condition));
        if (hasAnyOf()) {
            parts.add("anyOf" + anyOf);
        }
        if (!allOf.isEmpty()) {
            parts.add("allOf" + allOf);
        }
        return "{" + String.join(", ", parts) + "}";
    }
}
