package dev.devanks.solarcrm.catalog.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "manufacturers")
public class ManufacturerEntity implements CatalogDocument {

    @DocumentId
    private String id;
    private String externalId;
    private String name;
    // Stored as the enum name so client-side filters can compare strings
    private String type;
    private String scope;
    private Boolean isDefault;

    private String country;
    private String website;
    private String description;
    private String logoUrl;
    private Integer foundedYear;
    private Boolean active;

    private Boolean isDeleted;
    private Instant deletedAt;
    private Instant createdAt;
    private Instant updatedAt;
}
