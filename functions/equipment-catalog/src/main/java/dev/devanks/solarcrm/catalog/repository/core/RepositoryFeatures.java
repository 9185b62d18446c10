package dev.devanks.solarcrm.catalog.repository.core;

import dev.devanks.solarcrm.catalog.repository.query.Query;
import lombok.Builder;
import lombok.Value;

import java.util.function.Function;

/**
 * Behaviour switches of a {@link GenericRepository}.
 *
 * @param <F> filter type accepted by the repository
 */
@Value
@Builder
public class RepositoryFeatures<F> {

    @Builder.Default
    boolean softDelete = true;
    @Builder.Default
    boolean timestamps = true;
    @Builder.Default
    boolean pagination = true;
    /**
     * Translates the entity's filter into a query fragment; {@code null} when filters are ignored.
     */
    Function<F, Query> customFilters;

    public Query filterQuery(F filters) {
        if (customFilters == null || filters == null) {
            return Query.empty();
        }
        Query query = customFilters.apply(filters);
        return query == null ? Query.empty() : query;
    }
}
