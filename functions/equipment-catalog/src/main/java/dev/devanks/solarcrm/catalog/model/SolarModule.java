package dev.devanks.solarcrm.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SolarModule implements Equipment {

    private String id;
    private String manufacturerId;
    private String scope;
    private String model;

    private double nominalPowerW;
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

    private DiodeModelParameters diodeModel;
    private SapmThermalParameters thermalModel;

    private Instant createdAt;
    private Instant updatedAt;

    @Override
    public ManufacturerType kind() {
        return ManufacturerType.SOLAR_MODULE;
    }

    /**
     * Module area in square metres, when both dimensions are known.
     */
    public Optional<Double> areaM2() {
        if (widthMm == null || heightMm == null) {
            return Optional.empty();
        }
        return Optional.of(widthMm * heightMm / 1_000_000d);
    }

    public Optional<Double> powerDensityWm2() {
        return areaM2()
                .filter(area -> area > 0)
                .map(area -> nominalPowerW / area);
    }
}
