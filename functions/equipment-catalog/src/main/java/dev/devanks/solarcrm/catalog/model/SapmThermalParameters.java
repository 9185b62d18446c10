package dev.devanks.solarcrm.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sandia array performance model thermal and air-mass coefficients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SapmThermalParameters {
    private Double a0;
    private Double a1;
    private Double a2;
    private Double a3;
    private Double a4;
    private Double b0;
    private Double b1;
    private Double b2;
    private Double b3;
    private Double b4;
    private Double b5;
    private Double dtc;
}
