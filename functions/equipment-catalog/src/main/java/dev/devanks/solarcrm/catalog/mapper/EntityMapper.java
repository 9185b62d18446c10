package dev.devanks.solarcrm.catalog.mapper;

/**
 * Translates between a domain entity and its Firestore document. Mappers carry no business rules.
 *
 * @param <E> domain entity
 * @param <D> persisted document
 */
public interface EntityMapper<E, D> {

    E toDomain(D document);

    D toPersistence(E entity);

    /**
     * Document used to replace the mutable fields of a stored one.
     */
    default D toUpdate(E entity) {
        return toPersistence(entity);
    }
}
