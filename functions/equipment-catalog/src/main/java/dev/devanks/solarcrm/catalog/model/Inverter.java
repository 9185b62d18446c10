package dev.devanks.solarcrm.catalog.model;

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
public class Inverter implements Equipment {

    private String id;
    private String manufacturerId;
    private String scope;
    private String model;

    private double ratedAcPowerW;
    private String gridType;

    // DC input
    private Double maxPvPowerW;
    private Double maxDcVoltageV;
    private Integer mpptCount;
    private Integer stringsPerMppt;
    private String mpptVoltageRange;
    private Double maxInputCurrentA;

    // AC output
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

    private Instant createdAt;
    private Instant updatedAt;

    @Override
    public ManufacturerType kind() {
        return ManufacturerType.INVERTER;
    }

    /**
     * Total number of strings the inverter accepts, when both MPPT figures are known.
     */
    public Integer maxStringCount() {
        if (mpptCount == null || stringsPerMppt == null) {
            return null;
        }
        return mpptCount * stringsPerMppt;
    }
}
