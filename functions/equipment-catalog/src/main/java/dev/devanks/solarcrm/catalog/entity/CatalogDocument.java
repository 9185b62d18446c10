package dev.devanks.solarcrm.catalog.entity;

import java.time.Instant;

/**
 * Bookkeeping fields shared by every catalog collection. The generic repository core only touches
 * documents through this contract.
 */
public interface CatalogDocument {

    String getId();

    void setId(String id);

    Boolean getIsDeleted();

    void setIsDeleted(Boolean isDeleted);

    Instant getDeletedAt();

    void setDeletedAt(Instant deletedAt);

    Instant getCreatedAt();

    void setCreatedAt(Instant createdAt);

    Instant getUpdatedAt();

    void setUpdatedAt(Instant updatedAt);
}
