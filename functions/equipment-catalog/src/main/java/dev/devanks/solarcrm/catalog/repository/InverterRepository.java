package dev.devanks.solarcrm.catalog.repository;

import dev.devanks.solarcrm.catalog.model.CatalogScope;
import dev.devanks.solarcrm.catalog.model.Inverter;
import dev.devanks.solarcrm.catalog.model.InverterFilter;
import dev.devanks.solarcrm.catalog.repository.core.GenericRepository;
import dev.devanks.solarcrm.catalog.repository.query.Query;
import reactor.core.publisher.Flux;

import static dev.devanks.solarcrm.catalog.repository.SolarModuleRepository.equalTo;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.buildAccessFilter;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.buildRangeFilter;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.buildSearchFilter;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.mergeAll;

public class InverterRepository extends CatalogEntityRepository<Inverter, InverterFilter> {

    public InverterRepository(GenericRepository<Inverter, InverterFilter> core) {
        super(core);
    }

    public static Query buildFilterQuery(InverterFilter filter) {
        return mergeAll(
                buildAccessFilter(filter.getScope()),
                equalTo("manufacturerId", filter.getManufacturerId()),
                equalTo("gridType", filter.getGridType()),
                buildRangeFilter("ratedAcPowerW", filter.getMinPowerW(), filter.getMaxPowerW()),
                buildSearchFilter(filter.getSearch(), "model", "gridType"));
    }

    public Flux<Inverter> findByManufacturer(String manufacturerId, CatalogScope scope) {
        return findByFilters(InverterFilter.builder()
                .scope(scope)
                .manufacturerId(manufacturerId)
                .build());
    }
}
