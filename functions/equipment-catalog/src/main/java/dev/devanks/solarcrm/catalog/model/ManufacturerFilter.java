package dev.devanks.solarcrm.catalog.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ManufacturerFilter {
    /**
     * Visibility of the caller; {@code null} means public records only.
     */
    CatalogScope scope;
    /**
     * Exact name, compared case-insensitively.
     */
    String name;
    /**
     * Manufacturers producing this kind, including those of type {@link ManufacturerType#BOTH}.
     */
    ManufacturerType produces;
    Boolean isDefault;
    String search;
}
