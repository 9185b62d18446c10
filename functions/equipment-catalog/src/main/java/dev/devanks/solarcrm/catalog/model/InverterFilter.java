package dev.devanks.solarcrm.catalog.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class InverterFilter {
    CatalogScope scope;
    String manufacturerId;
    String gridType;
    Double minPowerW;
    Double maxPowerW;
    String search;
}
