package dev.devanks.solarcrm.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single-diode model coefficients at reference conditions, plus the temperature coefficients the
 * simulation service needs alongside them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiodeModelParameters {
    private Double aRef;    // modified ideality factor [V]
    private Double iLRef;   // light-generated current [A]
    private Double ioRef;   // diode reverse saturation current [A]
    private Double rs;      // series resistance [ohm]
    private Double rshRef;  // shunt resistance [ohm]
    private Double alphaSc; // short-circuit current temperature coefficient [A/C]
    private Double betaOc;  // open-circuit voltage temperature coefficient [V/C]
    private Double gammaR;  // power temperature coefficient [1/C]
}
