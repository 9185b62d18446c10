package dev.devanks.solarcrm.catalog.model;

/**
 * Common view of catalog items that belong to a manufacturer.
 */
public interface Equipment {

    String getId();

    String getManufacturerId();

    String getScope();

    String getModel();

    /**
     * {@link ManufacturerType#SOLAR_MODULE} or {@link ManufacturerType#INVERTER}.
     */
    ManufacturerType kind();
}
