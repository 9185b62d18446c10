package dev.devanks.solarcrm.catalog.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import dev.devanks.solarcrm.catalog.model.SandiaInverterParameters;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "inverters")
public class InverterEntity implements CatalogDocument {

    @DocumentId
    private String id;
    private String manufacturerId;
    private String scope;
    private String model;

    private Double ratedAcPowerW;
    private String gridType;

    private Double maxPvPowerW;
    private Double maxDcVoltageV;
    private Integer mpptCount;
    private Integer stringsPerMppt;
    private String mpptVoltageRange;
    private Double maxInputCurrentA;

    private Double maxApparentPowerVa;
    private Double maxOutputCurrentA;
    private String nominalOutputVoltage;
    private Double nominalFrequencyHz;

    private Double maxEfficiencyPercent;
    private Double europeanEfficiencyPercent;
    private Double mpptEfficiencyPercent;

    private List<String> protections;
    private List<String> certifications;
    private String ipRating;
    private Double weightKg;
    private Integer warrantyYears;
    private String datasheetUrl;
    private Double referencePrice;

    private SandiaInverterParameters sandiaModel;

    private Boolean isDeleted;
    private Instant deletedAt;
    private Instant createdAt;
    private Instant updatedAt;
}
