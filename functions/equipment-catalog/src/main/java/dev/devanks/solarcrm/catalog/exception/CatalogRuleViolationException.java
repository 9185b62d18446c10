package dev.devanks.solarcrm.catalog.exception;

import dev.devanks.solarcrm.catalog.aggregate.CatalogViolation;
import lombok.Getter;

/**
 * Raised when a catalog mutation would break one of the catalog rules. Nothing has been written when
 * this is thrown.
 */
@Getter
public class CatalogRuleViolationException extends CatalogException {

    private final transient CatalogViolation violation;

    public CatalogRuleViolationException(CatalogViolation violation) {
        super(violation.getMessage());
        this.violation = violation;
    }
}
