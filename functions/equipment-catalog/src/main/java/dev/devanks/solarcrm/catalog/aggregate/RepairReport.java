package dev.devanks.solarcrm.catalog.aggregate;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of a single repair pass over a catalog.
 */
@Value
@Builder
public class RepairReport {
    EquipmentCatalog catalog;
    int repairedCount;
    @Singular
    List<String> removedModuleIds;
    @Singular
    List<String> removedInverterIds;
    @Singular
    List<String> updatedManufacturerIds;
    /**
     * Violations found at the start that the repair does not handle (duplicate names).
     */
    @Singular
    List<CatalogViolation> unresolvedViolations;
    /**
     * Violations still present after the pass; reported, not repaired.
     */
    @Singular
    List<CatalogViolation> remainingViolations;

    public boolean isConsistent() {
        return remainingViolations.isEmpty();
    }
}
