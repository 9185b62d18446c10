package dev.devanks.solarcrm.catalog.model;

/**
 * Kind of equipment a manufacturer produces.
 */
public enum ManufacturerType {
    SOLAR_MODULE,
    INVERTER,
    BOTH;

    /**
     * Whether a manufacturer of this type can produce equipment of the given kind.
     *
     * @param kind {@link #SOLAR_MODULE} or {@link #INVERTER}
     */
    public boolean canProduce(ManufacturerType kind) {
        return this == BOTH || this == kind;
    }

    public String displayName() {
        return name().replace('_', ' ').toLowerCase();
    }
}
