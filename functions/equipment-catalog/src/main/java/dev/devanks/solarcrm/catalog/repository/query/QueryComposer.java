package dev.devanks.solarcrm.catalog.repository.query;

import dev.devanks.solarcrm.catalog.model.CatalogScope;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

import static dev.devanks.solarcrm.catalog.model.CatalogScope.PUBLIC_EQUIPMENT;
import static dev.devanks.solarcrm.catalog.repository.query.Condition.eq;
import static org.springframework.util.StringUtils.hasText;

/**
 * Builds and combines query fragments.
 * <p>
 * Fragments are combined with {@link #mergeQueries(Query, Query)}, which never lets one fragment's
 * {@code anyOf} group or field condition overwrite another's.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class QueryComposer {

    public static final String SCOPE_FIELD = "scope";
    public static final String IS_DELETED_FIELD = "isDeleted";

    /**
     * Conjunction of two fragments.
     * <ul>
     *     <li>an empty fragment yields the other one;</li>
     *     <li>when both carry an {@code anyOf} group, or both constrain the same field, the result is an
     *     {@code allOf} of each group, each field set and each existing {@code allOf} member;</li>
     *     <li>otherwise fields are combined, the single {@code anyOf} group is kept and the {@code allOf}
     *     groups are concatenated.</li>
     * </ul>
     */
    public static Query mergeQueries(Query left, Query right) {
        if (left == null || left.isEmpty()) {
            return right == null ? Query.empty() : right;
        }
        if (right == null || right.isEmpty()) {
            return left;
        }
        boolean bothGrouped = left.hasAnyOf() && right.hasAnyOf();
        boolean sharedField = !Collections.disjoint(left.getFields().keySet(), right.getFields().keySet());
        if (bothGrouped || sharedField) {
            List<Query> parts = new ArrayList<>();
            addGroup(parts, left);
            addGroup(parts, right);
            addFields(parts, left);
            addFields(parts, right);
            parts.addAll(left.getAllOf());
            parts.addAll(right.getAllOf());
            return Query.allOf(parts);
        }
        var fields = new LinkedHashMap<>(left.getFields());
        fields.putAll(right.getFields());
        List<Query> anyOf = left.hasAnyOf() ? left.getAnyOf() : right.getAnyOf();
        List<Query> allOf = new ArrayList<>(left.getAllOf());
        allOf.addAll(right.getAllOf());
        return Query.of(fields, anyOf, allOf);
    }

    /**
     * Folds fragments left to right with {@link #mergeQueries(Query, Query)}.
     */
    public static Query mergeAll(Query... fragments) {
        Query result = Query.empty();
        for (Query fragment : fragments) {
            result = mergeQueries(result, fragment);
        }
        return result;
    }

    /**
     * Records visible from a team: its own and public ones. A blank team sees public records only.
     */
    public static Query buildAccessFilter(String teamId) {
        return buildAccessFilter(CatalogScope.team(teamId));
    }

    public static Query buildAccessFilter(CatalogScope scope) {
        if (scope == null) {
            return Query.where(SCOPE_FIELD, eq(PUBLIC_EQUIPMENT));
        }
        switch (scope.getKind()) {
            case ALL:
                return Query.empty();
            case TEAM:
                return Query.anyOf(
                        Query.where(SCOPE_FIELD, eq(scope.getTeamId())),
                        Query.where(SCOPE_FIELD, eq(PUBLIC_EQUIPMENT)));
            default:
                return Query.where(SCOPE_FIELD, eq(PUBLIC_EQUIPMENT));
        }
    }

    /**
     * Case-insensitive substring search over the given fields; the term is matched literally.
     */
    public static Query buildSearchFilter(String term, String... fields) {
        if (!hasText(term) || fields.length == 0) {
            return Query.empty();
        }
        String regex = java.util.regex.Pattern.quote(term.trim());
        List<Query> alternatives = new ArrayList<>();
        for (String field : fields) {
            alternatives.add(Query.where(field, Condition.pattern(regex)));
        }
        return Query.anyOf(alternatives);
    }

    public static Query buildRangeFilter(String field, Number min, Number max) {
        if (min == null && max == null) {
            return Query.empty();
        }
        return Query.where(field, Condition.range(min, max));
    }

    public static Query buildIdQuery(IdFields idFields, String id) {
        if (!idFields.hasSecondary()) {
            return Query.where(idFields.getPrimary(), eq(id));
        }
        return Query.anyOf(
                Query.where(idFields.getPrimary(), eq(id)),
                Query.where(idFields.getSecondary(), eq(id)));
    }

    /**
     * Records not soft-deleted: the flag is {@code false} or was never written.
     */
    public static Query softDeleteQuery() {
        return Query.anyOf(
                Query.where(IS_DELETED_FIELD, eq(false)),
                Query.where(IS_DELETED_FIELD, Condition.missing()));
    }

    private static void addGroup(List<Query> parts, Query query) {
        if (query.hasAnyOf()) {
            parts.add(Query.anyOf(query.getAnyOf()));
        }
    }

    private static void addFields(List<Query> parts, Query query) {
        if (!query.getFields().isEmpty()) {
            parts.add(Query.fields(query.getFields()));
        }
    }
}
