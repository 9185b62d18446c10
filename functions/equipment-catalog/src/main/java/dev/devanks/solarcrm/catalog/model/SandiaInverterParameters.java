package dev.devanks.solarcrm.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sandia grid-connected inverter model coefficients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SandiaInverterParameters {
    private Double paco; // AC power rating [W]
    private Double pdco; // DC power at which paco is reached [W]
    private Double vdco; // DC voltage at which paco is reached [V]
    private Double pso;  // DC power to start inversion [W]
    private Double c0;
    private Double c1;
    private Double c2;
    private Double c3;
    private Double pnt;  // night tare loss [W]
}
