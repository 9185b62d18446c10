package dev.devanks.solarcrm.catalog.repository.unique;

import com.google.api.core.ApiFuture;
import com.google.api.core.ApiFutureCallback;
import com.google.api.core.ApiFutures;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.Firestore;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import com.google.common.util.concurrent.MoreExecutors;
import dev.devanks.solarcrm.catalog.aggregate.CatalogViolation;
import dev.devanks.solarcrm.catalog.exception.CatalogPersistenceException;
import dev.devanks.solarcrm.catalog.exception.CatalogRuleViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Reservation documents in a Firestore collection, one per key, keyed by the SHA-256 of the key.
 */
@Slf4j
@RequiredArgsConstructor
public class FirestoreUniqueKeyRegistry implements UniqueKeyRegistry {

    private final Firestore firestore;
    private final String collectionName;

    @Override
    public Mono<Void> reserve(UniqueKey key, String ownerId) {
        Map<String, Object> data = new HashMap<>();
        data.put("kind", key.getKind().name());
        data.put("scopeKey", key.getScopeKey());
        data.put("name", key.getName());
        data.put("ownerId", ownerId);
        return Mono.defer(() -> toMono(document(key).create(data)))
                .doOnSuccess(result -> log.debug("Reserved {} for {}", key, ownerId))
                .onErrorMap(e -> isAlreadyExists(e)
                        ? new CatalogRuleViolationException(CatalogViolation.of(key.violationType(),
                        "Name already taken: " + key.getName(), ownerId))
                        : new CatalogPersistenceException("Failed to reserve " + key + ": " + e.getMessage(), e))
                .doOnError(CatalogPersistenceException.class, e -> log.error(e.getMessage(), e))
                .then();
    }

    @Override
    public Mono<Void> release(UniqueKey key) {
        return Mono.defer(() -> toMono(document(key).delete()))
                .doOnSuccess(result -> log.debug("Released {}", key))
                .onErrorMap(e -> new CatalogPersistenceException("Failed to release " + key + ": " + e.getMessage(), e))
                .doOnError(e -> log.error(e.getMessage(), e))
                .then();
    }

    private DocumentReference document(UniqueKey key) {
        return firestore.collection(collectionName).document(key.documentId());
    }

    @VisibleForTesting
    static boolean isAlreadyExists(Throwable error) {
        return Throwables.getCausalChain(error).stream()
                .anyMatch(cause -> cause instanceof ApiException
                        && ((ApiException) cause).getStatusCode().getCode() == StatusCode.Code.ALREADY_EXISTS);
    }

    private static <T> Mono<T> toMono(ApiFuture<T> future) {
        return Mono.create(sink -> ApiFutures.addCallback(future, new ApiFutureCallback<T>() {
            @Override
            public void onFailure(Throwable t) {
                sink.error(t);
            }

            @Override
            public void onSuccess(T result) {
                sink.success(result);
            }
        }, MoreExecutors.directExecutor()));
    }
}
