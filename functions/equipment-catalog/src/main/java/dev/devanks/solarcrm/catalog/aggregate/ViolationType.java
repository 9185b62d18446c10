package dev.devanks.solarcrm.catalog.aggregate;

public enum ViolationType {
    NOT_FOUND,
    ALREADY_EXISTS,
    DUPLICATE_NAME,
    DUPLICATE_MODEL,
    /**
     * A manufacturer still has modules or inverters referencing it.
     */
    HAS_DEPENDENTS,
    /**
     * Equipment references a manufacturer that is blank, unknown or not visible from the equipment's scope.
     */
    DANGLING_REFERENCE,
    INCOMPATIBLE_MANUFACTURER,
    PROTECTED_DEFAULT
}
