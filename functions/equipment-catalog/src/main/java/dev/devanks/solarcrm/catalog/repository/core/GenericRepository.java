package dev.devanks.solarcrm.catalog.repository.core;

import dev.devanks.solarcrm.catalog.model.PaginatedResult;
import dev.devanks.solarcrm.catalog.model.PaginationOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Entity-agnostic CRUD with optional soft delete, timestamps and pagination.
 * <p>
 * Lookups resolve to an empty {@link Mono} when nothing matches. Storage failures surface as
 * {@link dev.devanks.solarcrm.catalog.exception.CatalogPersistenceException}.
 *
 * @param <E> domain entity
 * @param <F> filter type
 */
public interface GenericRepository<E, F> {

    /**
     * Persists a new entity. An id is generated when the entity has none. A supplied id that any stored
     * document already uses fails with a {@code CatalogRuleViolationException} ({@code ALREADY_EXISTS}).
     */
    Mono<E> create(E entity);

    Mono<E> findById(String id);

    Flux<E> findAll();

    /**
     * Every live entity matching the filters, unpaginated.
     */
    Flux<E> findByFilters(F filters);

    /**
     * Replaces the mutable fields of a stored entity. Fails with
     * {@link dev.devanks.solarcrm.catalog.exception.CatalogEntityNotFoundException} when the id does not
     * resolve.
     */
    Mono<E> update(E entity);

    /**
     * Merges the named fields into the stored entity. Empty when the id does not resolve.
     *
     * @throws IllegalArgumentException (signalled) for field names the entity does not have
     */
    Mono<E> updateById(String id, Map<String, Object> fields);

    /**
     * Soft delete when the feature is enabled, hard delete otherwise.
     */
    Mono<Boolean> delete(String id);

    /**
     * @return {@code true} if a live record was marked deleted, {@code false} when none was found
     */
    Mono<Boolean> softDelete(String id);

    Mono<Boolean> hardDelete(String id);

    Mono<PaginatedResult<E>> findWithPagination(F filters, PaginationOptions options);

    Mono<Long> count(F filters);

    Mono<Boolean> exists(String id);
}
