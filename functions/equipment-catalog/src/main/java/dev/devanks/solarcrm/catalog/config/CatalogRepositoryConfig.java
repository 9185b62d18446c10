package dev.devanks.solarcrm.catalog.config;

import com.google.cloud.firestore.Firestore;
import dev.devanks.solarcrm.catalog.entity.InverterEntity;
import dev.devanks.solarcrm.catalog.entity.ManufacturerEntity;
import dev.devanks.solarcrm.catalog.entity.SolarModuleEntity;
import dev.devanks.solarcrm.catalog.mapper.InverterMapper;
import dev.devanks.solarcrm.catalog.mapper.ManufacturerMapper;
import dev.devanks.solarcrm.catalog.mapper.SolarModuleMapper;
import dev.devanks.solarcrm.catalog.model.Inverter;
import dev.devanks.solarcrm.catalog.model.InverterFilter;
import dev.devanks.solarcrm.catalog.model.Manufacturer;
import dev.devanks.solarcrm.catalog.model.ManufacturerFilter;
import dev.devanks.solarcrm.catalog.model.SolarModule;
import dev.devanks.solarcrm.catalog.model.SolarModuleFilter;
import dev.devanks.solarcrm.catalog.repository.EquipmentCatalogRepository;
import dev.devanks.solarcrm.catalog.repository.FirestoreEquipmentCatalogRepository;
import dev.devanks.solarcrm.catalog.repository.InverterDocumentRepository;
import dev.devanks.solarcrm.catalog.repository.InverterRepository;
import dev.devanks.solarcrm.catalog.repository.ManufacturerDocumentRepository;
import dev.devanks.solarcrm.catalog.repository.ManufacturerRepository;
import dev.devanks.solarcrm.catalog.repository.SolarModuleDocumentRepository;
import dev.devanks.solarcrm.catalog.repository.SolarModuleRepository;
import dev.devanks.solarcrm.catalog.repository.core.FirestoreGenericRepository;
import dev.devanks.solarcrm.catalog.repository.core.RepositoryConfig;
import dev.devanks.solarcrm.catalog.repository.core.RepositoryFeatures;
import dev.devanks.solarcrm.catalog.repository.query.IdFields;
import dev.devanks.solarcrm.catalog.repository.unique.FirestoreUniqueKeyRegistry;
import dev.devanks.solarcrm.catalog.repository.unique.UniqueKeyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the catalog repositories once at startup. Callers depend on the interfaces only.
 */
@Configuration
@Slf4j
public class CatalogRepositoryConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ManufacturerRepository manufacturerRepository(ManufacturerDocumentRepository documents,
                                                         ManufacturerMapper mapper,
                                                         CatalogProperties properties,
                                                         Clock clock) {
        var config = RepositoryConfig.<Manufacturer, ManufacturerEntity, ManufacturerFilter>builder()
                .entityName("Manufacturer")
                .mapper(mapper)
                .features(RepositoryFeatures.<ManufacturerFilter>builder()
                        .customFilters(ManufacturerRepository::buildFilterQuery)
                        .build())
                .idFields(IdFields.of("id", ManufacturerRepository.EXTERNAL_ID_FIELD))
                .defaultPageSize(properties.getDefaultPageSize())
                .maxPageSize(properties.getMaxPageSize())
                .build();
        return new ManufacturerRepository(new FirestoreGenericRepository<>(documents, config, clock));
    }

    @Bean
    public SolarModuleRepository solarModuleRepository(SolarModuleDocumentRepository documents,
                                                       SolarModuleMapper mapper,
                                                       CatalogProperties properties,
                                                       Clock clock) {
        var config = RepositoryConfig.<SolarModule, SolarModuleEntity, SolarModuleFilter>builder()
                .entityName("Solar module")
                .mapper(mapper)
                .features(RepositoryFeatures.<SolarModuleFilter>builder()
                        .customFilters(SolarModuleRepository::buildFilterQuery)
                        .build())
                .defaultPageSize(properties.getDefaultPageSize())
                .maxPageSize(properties.getMaxPageSize())
                .build();
        return new SolarModuleRepository(new FirestoreGenericRepository<>(documents, config, clock));
    }

    @Bean
    public InverterRepository inverterRepository(InverterDocumentRepository documents,
                                                 InverterMapper mapper,
                                                 CatalogProperties properties,
                                                 Clock clock) {
        var config = RepositoryConfig.<Inverter, InverterEntity, InverterFilter>builder()
                .entityName("Inverter")
                .mapper(mapper)
                .features(RepositoryFeatures.<InverterFilter>builder()
                        .customFilters(InverterRepository::buildFilterQuery)
                        .build())
                .defaultPageSize(properties.getDefaultPageSize())
                .maxPageSize(properties.getMaxPageSize())
                .build();
        return new InverterRepository(new FirestoreGenericRepository<>(documents, config, clock));
    }

    @Bean
    public UniqueKeyRegistry uniqueKeyRegistry(Firestore firestore, CatalogProperties properties) {
        if (!properties.getUniqueKeys().isEnabled()) {
            log.warn("Unique key reservations are disabled; name uniqueness is checked in memory only.");
            return UniqueKeyRegistry.noop();
        }
        log.info("Using unique key reservations in collection {}", properties.getUniqueKeys().getCollectionName());
        return new FirestoreUniqueKeyRegistry(firestore, properties.getUniqueKeys().getCollectionName());
    }

    @Bean
    public EquipmentCatalogRepository equipmentCatalogRepository(ManufacturerRepository manufacturers,
                                                                 SolarModuleRepository modules,
                                                                 InverterRepository inverters,
                                                                 UniqueKeyRegistry uniqueKeyRegistry,
                                                                 CatalogProperties properties) {
        return new FirestoreEquipmentCatalogRepository(manufacturers, modules, inverters, uniqueKeyRegistry,
                properties.getLoadTimeout());
    }
}
