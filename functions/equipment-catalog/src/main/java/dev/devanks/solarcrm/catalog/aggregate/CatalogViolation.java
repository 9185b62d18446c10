package dev.devanks.solarcrm.catalog.aggregate;

import lombok.Value;

/**
 * A broken catalog rule, either rejected at mutation time or found by a consistency check.
 */
@Value(staticConstructor = "of")
public class CatalogViolation {
    ViolationType type;
    String message;
    /**
     * Id of the entity the violation is about, when there is one.
     */
    String entityId;
}
