package dev.devanks.solarcrm.catalog.repository;

import dev.devanks.solarcrm.catalog.model.CatalogScope;
import dev.devanks.solarcrm.catalog.model.Manufacturer;
import dev.devanks.solarcrm.catalog.model.ManufacturerFilter;
import dev.devanks.solarcrm.catalog.model.ManufacturerType;
import dev.devanks.solarcrm.catalog.repository.core.GenericRepository;
import dev.devanks.solarcrm.catalog.repository.query.Condition;
import dev.devanks.solarcrm.catalog.repository.query.Query;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.regex.Pattern;

import static dev.devanks.solarcrm.catalog.repository.query.Condition.eq;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.buildAccessFilter;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.buildSearchFilter;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.mergeAll;
import static org.springframework.util.StringUtils.hasText;

@Slf4j
public class ManufacturerRepository extends CatalogEntityRepository<Manufacturer, ManufacturerFilter> {

    /**
     * Secondary id field; manufacturers can be looked up by their external catalog id.
     */
    public static final String EXTERNAL_ID_FIELD = "externalId";

    public ManufacturerRepository(GenericRepository<Manufacturer, ManufacturerFilter> core) {
        super(core);
    }

    /**
     * Query fragment for a manufacturer filter: access scope, exact name, producible kind, default flag and
     * free-text search, merged in that order.
     */
    public static Query buildFilterQuery(ManufacturerFilter filter) {
        Query name = hasText(filter.getName())
                ? Query.where("name", Condition.pattern("^" + Pattern.quote(filter.getName().trim()) + "$"))
                : Query.empty();
        Query isDefault = filter.getIsDefault() != null
                ? Query.where("isDefault", eq(filter.getIsDefault()))
                : Query.empty();
        return mergeAll(
                buildAccessFilter(filter.getScope()),
                name,
                producing(filter.getProduces()),
                isDefault,
                buildSearchFilter(filter.getSearch(), "name", "country", "description"));
    }

    private static Query producing(ManufacturerType kind) {
        if (kind == null) {
            return Query.empty();
        }
        if (kind == ManufacturerType.BOTH) {
            return Query.where("type", eq(ManufacturerType.BOTH.name()));
        }
        return Query.anyOf(
                Query.where("type", eq(kind.name())),
                Query.where("type", eq(ManufacturerType.BOTH.name())));
    }

    public Mono<Manufacturer> findByName(String name, String teamId) {
        if (!hasText(name)) {
            return Mono.empty();
        }
        return findByFilters(ManufacturerFilter.builder()
                        .scope(CatalogScope.team(teamId))
                        .name(name)
                        .build())
                .next();
    }

    /**
     * Manufacturers able to produce the given kind, {@link ManufacturerType#BOTH} included.
     */
    public Flux<Manufacturer> findByType(ManufacturerType type, String teamId) {
        return findByFilters(ManufacturerFilter.builder()
                .scope(CatalogScope.team(teamId))
                .produces(type)
                .build());
    }

    public Flux<Manufacturer> findAccessible(String teamId) {
        return findByFilters(ManufacturerFilter.builder()
                .scope(CatalogScope.team(teamId))
                .build());
    }

    public Flux<Manufacturer> findDefaults() {
        return findByFilters(ManufacturerFilter.builder()
                        .scope(CatalogScope.all())
                        .isDefault(true)
                        .build())
                .doOnComplete(() -> log.debug("Completed fetching default manufacturers"));
    }
}
