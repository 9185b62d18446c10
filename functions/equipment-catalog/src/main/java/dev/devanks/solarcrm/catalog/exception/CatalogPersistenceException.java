package dev.devanks.solarcrm.catalog.exception;

/**
 * Wraps failures of the underlying document store.
 */
public class CatalogPersistenceException extends CatalogException {
    public CatalogPersistenceException(String message) {
        super(message);
    }

    public CatalogPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
