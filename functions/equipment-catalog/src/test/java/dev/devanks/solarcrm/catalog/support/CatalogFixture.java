package dev.devanks.solarcrm.catalog.support;

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
import dev.devanks.solarcrm.catalog.model.ManufacturerType;
import dev.devanks.solarcrm.catalog.model.SolarModule;
import dev.devanks.solarcrm.catalog.model.SolarModuleFilter;
import dev.devanks.solarcrm.catalog.repository.FirestoreEquipmentCatalogRepository;
import dev.devanks.solarcrm.catalog.repository.InverterRepository;
import dev.devanks.solarcrm.catalog.repository.ManufacturerRepository;
import dev.devanks.solarcrm.catalog.repository.SolarModuleRepository;
import dev.devanks.solarcrm.catalog.repository.core.FirestoreGenericRepository;
import dev.devanks.solarcrm.catalog.repository.core.RepositoryConfig;
import dev.devanks.solarcrm.catalog.repository.core.RepositoryFeatures;
import dev.devanks.solarcrm.catalog.repository.query.IdFields;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * The catalog repository stack wired the way the application wires it, over in-memory collections.
 */
public class CatalogFixture {

    public static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    public final InMemoryDocumentRepository<ManufacturerEntity> manufacturerDocuments =
            new InMemoryDocumentRepository<>(document -> document.toBuilder().build());
    public final InMemoryDocumentRepository<SolarModuleEntity> moduleDocuments =
            new InMemoryDocumentRepository<>(document -> document.toBuilder().build());
    public final InMemoryDocumentRepository<InverterEntity> inverterDocuments =
            new InMemoryDocumentRepository<>(document -> document.toBuilder().build());

    public final InMemoryUniqueKeyRegistry uniqueKeys = new InMemoryUniqueKeyRegistry();

    public final ManufacturerRepository manufacturers = new ManufacturerRepository(new FirestoreGenericRepository<>(
            manufacturerDocuments,
            RepositoryConfig.<Manufacturer, ManufacturerEntity, ManufacturerFilter>builder()
                    .entityName("Manufacturer")
                    .mapper(new ManufacturerMapper())
                    .features(RepositoryFeatures.<ManufacturerFilter>builder()
                            .customFilters(ManufacturerRepository::buildFilterQuery)
                            .build())
                    .idFields(IdFields.of("id", ManufacturerRepository.EXTERNAL_ID_FIELD))
                    .build(),
            clock));

    public final SolarModuleRepository modules = new SolarModuleRepository(new FirestoreGenericRepository<>(
            moduleDocuments,
            RepositoryConfig.<SolarModule, SolarModuleEntity, SolarModuleFilter>builder()
                    .entityName("Solar module")
                    .mapper(new SolarModuleMapper())
                    .features(RepositoryFeatures.<SolarModuleFilter>builder()
                            .customFilters(SolarModuleRepository::buildFilterQuery)
                            .build())
                    .build(),
            clock));

    public final InverterRepository inverters = new InverterRepository(new FirestoreGenericRepository<>(
            inverterDocuments,
            RepositoryConfig.<Inverter, InverterEntity, InverterFilter>builder()
                    .entityName("Inverter")
                    .mapper(new InverterMapper())
                    .features(RepositoryFeatures.<InverterFilter>builder()
                            .customFilters(InverterRepository::buildFilterQuery)
                            .build())
                    .build(),
            clock));

    public final FirestoreEquipmentCatalogRepository catalog = new FirestoreEquipmentCatalogRepository(
            manufacturers, modules, inverters, uniqueKeys, Duration.ofSeconds(5));

    public static Manufacturer manufacturer(String id, String name, ManufacturerType type, String scope) {
        return Manufacturer.builder().id(id).name(name).type(type).scope(scope).build();
    }

    public static SolarModule module(String id, String manufacturerId, String model, String scope, double powerW) {
        return SolarModule.builder()
                .id(id)
                .manufacturerId(manufacturerId)
                .model(model)
                .scope(scope)
                .nominalPowerW(powerW)
                .build();
    }

    public static Inverter inverter(String id, String manufacturerId, String model, String scope, double powerW) {
        return Inverter.builder()
                .id(id)
                .manufacturerId(manufacturerId)
                .model(model)
                .scope(scope)
                .ratedAcPowerW(powerW)
                .build();
    }
}
