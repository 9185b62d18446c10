package dev.devanks.solarcrm.catalog.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import dev.devanks.solarcrm.catalog.model.DiodeModelParameters;
import dev.devanks.solarcrm.catalog.model.SapmThermalParameters;
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
@Document(collectionName = "solar_modules")
public class SolarModuleEntity implements CatalogDocument {

    @DocumentId
    private String id;
    private String manufacturerId;
    private String scope;
    private String model;

    private Double nominalPowerW;
    private String cellType;
    private Double efficiencyPercent;
    private Integer cellCount;

    private Double widthMm;
    private Double heightMm;
    private Double thicknessMm;
    private Double weightKg;

    private Double vmpp;
    private Double impp;
    private Double voc;
    private Double isc;
    private Double tempCoefPmax;
    private Double tempCoefVoc;
    private Double tempCoefIsc;

    private String material;
    private String technology;
    private Integer warrantyYears;
    private String tolerance;
    private String datasheetUrl;
    private List<String> certifications;

    // Nested maps in Firestore
    private DiodeModelParameters diodeModel;
    private SapmThermalParameters thermalModel;

    private Boolean isDeleted;
    private Instant deletedAt;
    private Instant createdAt;
    private Instant updatedAt;
}
