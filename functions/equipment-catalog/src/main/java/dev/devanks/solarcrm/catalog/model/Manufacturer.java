package dev.devanks.solarcrm.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Manufacturer {

    private String id;
    /**
     * Identifier carried over from an external or legacy catalog, accepted wherever an id is.
     */
    private String externalId;
    private String name;
    private ManufacturerType type;
    private String scope;
    private boolean isDefault;

    private String country;
    private String website;
    private String description;
    private String logoUrl;
    private Integer foundedYear;
    @Builder.Default
    private boolean active = true;

    private Instant createdAt;
    private Instant updatedAt;

    public boolean isPublic() {
        return CatalogScope.isPublic(scope);
    }

    public boolean canProduce(ManufacturerType kind) {
        return type != null && type.canProduce(kind);
    }
}
