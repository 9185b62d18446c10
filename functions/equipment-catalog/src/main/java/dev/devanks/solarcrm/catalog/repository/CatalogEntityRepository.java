package dev.devanks.solarcrm.catalog.repository;

import dev.devanks.solarcrm.catalog.model.PaginatedResult;
import dev.devanks.solarcrm.catalog.model.PaginationOptions;
import dev.devanks.solarcrm.catalog.repository.core.GenericRepository;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Base of the per-entity repositories: plain CRUD goes to the generic core, subclasses add the
 * entity's own queries on top.
 */
@RequiredArgsConstructor
public abstract class CatalogEntityRepository<E, F> implements GenericRepository<E, F> {

    protected final GenericRepository<E, F> core;

    @Override
    public Mono<E> create(E entity) {
        return core.create(entity);
    }

    @Override
    public Mono<E> findById(String id) {
        return core.findById(id);
    }

    @Override
    public Flux<E> findAll() {
        return core.findAll();
    }

    @Override
    public Flux<E> findByFilters(F filters) {
        return core.findByFilters(filters);
    }

    @Override
    public Mono<E> update(E entity) {
        return core.update(entity);
    }

    @Override
    public Mono<E> updateById(String id, Map<String, Object> fields) {
        return core.updateById(id, fields);
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return core.delete(id);
    }

    @Override
    public Mono<Boolean> softDelete(String id) {
        return core.softDelete(id);
    }

    @Override
    public Mono<Boolean> hardDelete(String id) {
        return core.hardDelete(id);
    }

    @Override
    public Mono<PaginatedResult<E>> findWithPagination(F filters, PaginationOptions options) {
        return core.findWithPagination(filters, options);
    }

    @Override
    public Mono<Long> count(F filters) {
        return core.count(filters);
    }

    @Override
    public Mono<Boolean> exists(String id) {
        return core.exists(id);
    }
}
