package dev.devanks.solarcrm.catalog.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SolarModuleFilter {
    CatalogScope scope;
    String manufacturerId;
    String cellType;
    Double minPowerW;
    Double maxPowerW;
    String search;
}
