package dev.devanks.solarcrm.catalog.repository.core;

import dev.devanks.solarcrm.catalog.mapper.EntityMapper;
import dev.devanks.solarcrm.catalog.model.PaginationOptions;
import dev.devanks.solarcrm.catalog.repository.query.IdFields;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Per-entity configuration of a {@link FirestoreGenericRepository}.
 */
@Value
@Builder
public class RepositoryConfig<E, D, F> {

    /**
     * Name used in log lines and error messages, e.g. {@code "Manufacturer"}.
     */
    @NonNull
    String entityName;
    @NonNull
    EntityMapper<E, D> mapper;
    @NonNull
    RepositoryFeatures<F> features;
    @Builder.Default
    IdFields idFields = IdFields.primary("id");
    @Builder.Default
    int defaultPageSize = PaginationOptions.DEFAULT_PAGE_SIZE;
    @Builder.Default
    int maxPageSize = 100;
}
