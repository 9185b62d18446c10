package dev.devanks.solarcrm.catalog.support;

import dev.devanks.solarcrm.catalog.aggregate.CatalogViolation;
import dev.devanks.solarcrm.catalog.exception.CatalogRuleViolationException;
import dev.devanks.solarcrm.catalog.repository.unique.UniqueKey;
import dev.devanks.solarcrm.catalog.repository.unique.UniqueKeyRegistry;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

public class InMemoryUniqueKeyRegistry implements UniqueKeyRegistry {

    private final Map<String, String> owners = new LinkedHashMap<>();

    @Override
    public Mono<Void> reserve(UniqueKey key, String ownerId) {
        return Mono.defer(() -> {
            if (owners.putIfAbsent(key.documentId(), ownerId) != null) {
                return Mono.error(new CatalogRuleViolationException(
                        CatalogViolation.of(key.violationType(), "Name already taken: " + key.getName(), ownerId)));
            }
            return Mono.empty();
        });
    }

    @Override
    public Mono<Void> release(UniqueKey key) {
        return Mono.fromRunnable(() -> owners.remove(key.documentId()));
    }

    public boolean isReserved(UniqueKey key) {
        return owners.containsKey(key.documentId());
    }

    public String ownerOf(UniqueKey key) {
        return owners.get(key.documentId());
    }

    public int size() {
        return owners.size();
    }
}
