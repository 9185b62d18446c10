package dev.devanks.solarcrm.catalog.repository.core;

import dev.devanks.solarcrm.catalog.aggregate.CatalogViolation;
import dev.devanks.solarcrm.catalog.aggregate.ViolationType;
import dev.devanks.solarcrm.catalog.entity.CatalogDocument;
import dev.devanks.solarcrm.catalog.exception.CatalogEntityNotFoundException;
import dev.devanks.solarcrm.catalog.exception.CatalogException;
import dev.devanks.solarcrm.catalog.exception.CatalogPersistenceException;
import dev.devanks.solarcrm.catalog.exception.CatalogRuleViolationException;
import dev.devanks.solarcrm.catalog.mapper.EntityMapper;
import dev.devanks.solarcrm.catalog.model.PaginatedResult;
import dev.devanks.solarcrm.catalog.model.PaginationOptions;
import dev.devanks.solarcrm.catalog.repository.query.DocumentFields;
import dev.devanks.solarcrm.catalog.repository.query.Query;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.MutablePropertyValues;
import org.springframework.beans.PropertyAccessorFactory;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.buildIdQuery;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.mergeQueries;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.softDeleteQuery;
import static org.springframework.util.StringUtils.hasText;

/**
 * {@link GenericRepository} over a Firestore collection.
 * <p>
 * Firestore cannot express OR groups or regular expressions, so filtered reads fetch the collection and
 * evaluate the composed {@link Query} client-side. Lookups by primary id go straight to the document.
 *
 * @param <E> domain entity
 * @param <D> Firestore document
 * @param <F> filter type
 */
@Slf4j
public class FirestoreGenericRepository<E, D extends CatalogDocument, F> implements GenericRepository<E, F> {

    private static final String ID = "id";

    private final ReactiveCrudRepository<D, String> documents;
    private final RepositoryConfig<E, D, F> config;
    private final EntityMapper<E, D> mapper;
    private final RepositoryFeatures<F> features;
    private final Clock clock;

    public FirestoreGenericRepository(ReactiveCrudRepository<D, String> documents,
                                      RepositoryConfig<E, D, F> config,
                                      Clock clock) {
        this.documents = documents;
        this.config = config;
        this.mapper = config.getMapper();
        this.features = config.getFeatures();
        this.clock = clock;
    }

    /**
     * Inserts a new document. A caller-supplied id must not belong to any stored document, live or soft
     * deleted, since a Firestore save would replace it.
     */
    @Override
    public Mono<E> create(E entity) {
        D document = mapper.toPersistence(entity);
        boolean suppliedId = hasText(document.getId());
        if (!suppliedId) {
            document.setId(UUID.randomUUID().toString());
        }
        if (features.isTimestamps()) {
            Instant now = clock.instant();
            document.setCreatedAt(now);
            document.setUpdatedAt(now);
        }
        if (features.isSoftDelete()) {
            document.setIsDeleted(false);
            document.setDeletedAt(null);
        }
        log.debug("Creating {} with id {}", config.getEntityName(), document.getId());
        Mono<Boolean> taken = suppliedId ? documents.existsById(document.getId()) : Mono.just(false);
        return taken
                .flatMap(exists -> exists ? Mono.<D>error(idInUse(document.getId())) : documents.save(document))
                .map(mapper::toDomain)
                .doOnSuccess(created -> log.info("Created {} {}", config.getEntityName(), document.getId()))
                .doOnError(e -> log.error("Failed to create {} {}: {}", config.getEntityName(), document.getId(), e.getMessage(), e))
                .onErrorMap(this::toCatalogError);
    }

    @Override
    public Mono<E> findById(String id) {
        return findLiveDocument(id)
                .map(mapper::toDomain)
                .onErrorMap(this::toCatalogError);
    }

    @Override
    public Flux<E> findAll() {
        return findByFilters(null);
    }

    @Override
    public Flux<E> findByFilters(F filters) {
        Query query = mergeQueries(liveQuery(), features.filterQuery(filters));
        return matching(query)
                .map(mapper::toDomain)
                .doOnSubscribe(s -> log.debug("Fetching {} documents matching {}", config.getEntityName(), query))
                .doOnError(e -> log.error("Error fetching {} documents matching {}: {}", config.getEntityName(), query, e.getMessage(), e))
                .onErrorMap(this::toCatalogError);
    }

    @Override
    public Mono<E> update(E entity) {
        D replacement = mapper.toUpdate(entity);
        String id = replacement.getId();
        return findLiveDocument(id)
                .switchIfEmpty(Mono.error(() -> new CatalogEntityNotFoundException(config.getEntityName(), id)))
                .flatMap(existing -> {
                    replacement.setId(existing.getId());
                    replacement.setCreatedAt(existing.getCreatedAt());
                    replacement.setIsDeleted(existing.getIsDeleted());
                    replacement.setDeletedAt(existing.getDeletedAt());
                    replacement.setUpdatedAt(clock.instant());
                    return documents.save(replacement);
                })
                .map(mapper::toDomain)
                .doOnSuccess(updated -> log.info("Updated {} {}", config.getEntityName(), id))
                .doOnError(e -> log.error("Failed to update {} {}: {}", config.getEntityName(), id, e.getMessage(), e))
                .onErrorMap(this::toCatalogError);
    }

    @Override
    public Mono<E> updateById(String id, Map<String, Object> fields) {
        return findLiveDocument(id)
                .flatMap(existing -> applyFields(existing, fields))
                .flatMap(documents::save)
                .map(mapper::toDomain)
                .doOnError(e -> log.error("Failed to update {} {}: {}", config.getEntityName(), id, e.getMessage(), e))
                .onErrorMap(this::toCatalogError);
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return features.isSoftDelete() ? softDelete(id) : hardDelete(id);
    }

    @Override
    public Mono<Boolean> softDelete(String id) {
        return findDocument(id, softDeleteQuery())
                .flatMap(existing -> {
                    Instant now = clock.instant();
                    existing.setIsDeleted(true);
                    existing.setDeletedAt(now);
                    existing.setUpdatedAt(now);
                    return documents.save(existing);
                })
                .map(saved -> true)
                .defaultIfEmpty(false)
                .doOnNext(deleted -> log.debug("Soft delete of {} {}: {}", config.getEntityName(), id, deleted))
                .doOnError(e -> log.error("Failed to soft delete {} {}: {}", config.getEntityName(), id, e.getMessage(), e))
                .onErrorMap(this::toCatalogError);
    }

    @Override
    public Mono<Boolean> hardDelete(String id) {
        return findDocument(id, Query.empty())
                .flatMap(existing -> documents.deleteById(existing.getId()).thenReturn(true))
                .defaultIfEmpty(false)
                .doOnNext(deleted -> log.debug("Hard delete of {} {}: {}", config.getEntityName(), id, deleted))
                .doOnError(e -> log.error("Failed to delete {} {}: {}", config.getEntityName(), id, e.getMessage(), e))
                .onErrorMap(this::toCatalogError);
    }

    @Override
    public Mono<PaginatedResult<E>> findWithPagination(F filters, PaginationOptions options) {
        PaginationOptions effective = options != null
                ? options
                : PaginationOptions.page(1, config.getDefaultPageSize());
        if (effective.getPage() < 1) {
            return Mono.error(new IllegalArgumentException("Page must be at least 1, got " + effective.getPage()));
        }
        if (effective.getPageSize() < 1 || effective.getPageSize() > config.getMaxPageSize()) {
            return Mono.error(new IllegalArgumentException("Page size must be between 1 and "
                    + config.getMaxPageSize() + ", got " + effective.getPageSize()));
        }

        Query query = mergeQueries(liveQuery(), features.filterQuery(filters));
        Flux<D> matches = matching(query);

        if (!features.isPagination()) {
            return matches.map(mapper::toDomain)
                    .collectList()
                    .map(items -> PaginatedResult.of(items, items.size(), 1, Math.max(items.size(), 1)))
                    .onErrorMap(this::toCatalogError);
        }

        Mono<Long> total = matches.count();
        Mono<List<E>> page = matches
                .sort(DocumentFields.comparator(effective.getSortField(), effective.getSortDirection()))
                .skip(effective.offset())
                .take(effective.getPageSize())
                .map(mapper::toDomain)
                .collectList();

        return Mono.zip(total, page)
                .map(tuple -> PaginatedResult.of(tuple.getT2(), tuple.getT1(), effective.getPage(), effective.getPageSize()))
                .doOnSuccess(result -> log.debug("Fetched page {} of {} {} ({} total)",
                        effective.getPage(), result.getTotalPages(), config.getEntityName(), result.getTotal()))
                .doOnError(e -> log.error("Error paginating {}: {}", config.getEntityName(), e.getMessage(), e))
                .onErrorMap(this::toCatalogError);
    }

    @Override
    public Mono<Long> count(F filters) {
        Query query = mergeQueries(liveQuery(), features.filterQuery(filters));
        return matching(query)
                .count()
                .onErrorMap(this::toCatalogError);
    }

    @Override
    public Mono<Boolean> exists(String id) {
        return findLiveDocument(id)
                .hasElement()
                .onErrorMap(this::toCatalogError);
    }

    private Mono<D> findLiveDocument(String id) {
        return findDocument(id, liveQuery());
    }

    /**
     * Resolves an id to its document. With a secondary id field configured the collection is scanned,
     * since the alias is not the document key.
     */
    private Mono<D> findDocument(String id, Query baseQuery) {
        if (!hasText(id)) {
            return Mono.empty();
        }
        if (config.getIdFields().hasSecondary()) {
            return matching(mergeQueries(baseQuery, buildIdQuery(config.getIdFields(), id))).next();
        }
        return documents.findById(id).filter(baseQuery::matches);
    }

    private Flux<D> matching(Query query) {
        return query.isEmpty() ? documents.findAll() : documents.findAll().filter(query::matches);
    }

    private Query liveQuery() {
        return features.isSoftDelete() ? softDeleteQuery() : Query.empty();
    }

    private Mono<D> applyFields(D existing, Map<String, Object> fields) {
        var values = new LinkedHashMap<>(fields);
        values.remove(ID);
        values.remove(config.getIdFields().getPrimary());
        try {
            PropertyAccessorFactory.forBeanPropertyAccess(existing)
                    .setPropertyValues(new MutablePropertyValues(values), false);
        } catch (BeansException e) {
            return Mono.error(new IllegalArgumentException(
                    "Invalid fields for " + config.getEntityName() + ": " + e.getMessage(), e));
        }
        if (features.isTimestamps()) {
            existing.setUpdatedAt(clock.instant());
        }
        return Mono.just(existing);
    }

    private CatalogRuleViolationException idInUse(String id) {
        return new CatalogRuleViolationException(CatalogViolation.of(ViolationType.ALREADY_EXISTS,
                config.getEntityName() + " id already in use: " + id, id));
    }

    private Throwable toCatalogError(Throwable e) {
        if (e instanceof CatalogException || e instanceof IllegalArgumentException) {
            return e;
        }
        return new CatalogPersistenceException(
                "Storage operation on " + config.getEntityName() + " failed: " + e.getMessage(), e);
    }
}
