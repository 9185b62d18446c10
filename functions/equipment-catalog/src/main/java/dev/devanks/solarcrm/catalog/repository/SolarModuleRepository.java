package dev.devanks.solarcrm.catalog.repository;

import dev.devanks.solarcrm.catalog.model.CatalogScope;
import dev.devanks.solarcrm.catalog.model.SolarModule;
import dev.devanks.solarcrm.catalog.model.SolarModuleFilter;
import dev.devanks.solarcrm.catalog.repository.core.GenericRepository;
import dev.devanks.solarcrm.catalog.repository.query.Query;
import reactor.core.publisher.Flux;

import static dev.devanks.solarcrm.catalog.repository.query.Condition.eq;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.buildAccessFilter;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.buildRangeFilter;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.buildSearchFilter;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.mergeAll;
import static org.springframework.util.StringUtils.hasText;

public class SolarModuleRepository extends CatalogEntityRepository<SolarModule, SolarModuleFilter> {

    public SolarModuleRepository(GenericRepository<SolarModule, SolarModuleFilter> core) {
        super(core);
    }

    public static Query buildFilterQuery(SolarModuleFilter filter) {
        return mergeAll(
                buildAccessFilter(filter.getScope()),
                equalTo("manufacturerId", filter.getManufacturerId()),
                equalTo("cellType", filter.getCellType()),
                buildRangeFilter("nominalPowerW", filter.getMinPowerW(), filter.getMaxPowerW()),
                buildSearchFilter(filter.getSearch(), "model", "cellType", "technology"));
    }

    static Query equalTo(String field, String value) {
        return hasText(value) ? Query.where(field, eq(value)) : Query.empty();
    }

    public Flux<SolarModule> findByManufacturer(String manufacturerId, CatalogScope scope) {
        return findByFilters(SolarModuleFilter.builder()
                .scope(scope)
                .manufacturerId(manufacturerId)
                .build());
    }
}
