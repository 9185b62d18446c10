package dev.devanks.solarcrm.catalog.repository.unique;

import reactor.core.publisher.Mono;

/**
 * Storage-level guard for unique names. A reservation is created only if absent, so two concurrent writers
 * cannot both take the same key.
 */
public interface UniqueKeyRegistry {

    /**
     * Takes the key for {@code ownerId}. Signals
     * {@link dev.devanks.solarcrm.catalog.exception.CatalogRuleViolationException} when it is already taken.
     */
    Mono<Void> reserve(UniqueKey key, String ownerId);

    /**
     * Frees the key. Releasing a key that is not reserved completes normally.
     */
    Mono<Void> release(UniqueKey key);

    static UniqueKeyRegistry noop() {
        return new UniqueKeyRegistry() {
            @Override
            public Mono<Void> reserve(UniqueKey key, String ownerId) {
                return Mono.empty();
            }

            @Override
            public Mono<Void> release(UniqueKey key) {
                return Mono.empty();
            }
        };
    }
}
