package dev.devanks.solarcrm.catalog.exception;

import lombok.Getter;

@Getter
public class CatalogEntityNotFoundException extends CatalogException {

    private final String entityName;
    private final String entityId;

    public CatalogEntityNotFoundException(String entityName, String entityId) {
        super(entityName + " not found: " + entityId);
        this.entityName = entityName;
        this.entityId = entityId;
    }
}
