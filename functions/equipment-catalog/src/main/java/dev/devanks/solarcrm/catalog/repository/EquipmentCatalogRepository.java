package dev.devanks.solarcrm.catalog.repository;

import dev.devanks.solarcrm.catalog.aggregate.CatalogViolation;
import dev.devanks.solarcrm.catalog.aggregate.EquipmentCatalog;
import dev.devanks.solarcrm.catalog.model.CatalogScope;
import dev.devanks.solarcrm.catalog.model.Inverter;
import dev.devanks.solarcrm.catalog.model.Manufacturer;
import dev.devanks.solarcrm.catalog.model.ManufacturerType;
import dev.devanks.solarcrm.catalog.model.SolarModule;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Loads, checks and persists the equipment catalog.
 * <p>
 * Mutations load the catalog, apply the change to the {@link EquipmentCatalog} aggregate and write the one
 * affected entity only when every rule holds. Rejections surface as
 * {@link dev.devanks.solarcrm.catalog.exception.CatalogRuleViolationException} or
 * {@link dev.devanks.solarcrm.catalog.exception.CatalogEntityNotFoundException}. Writes across collections
 * are not transactional.
 */
public interface EquipmentCatalogRepository {

    Mono<EquipmentCatalog> loadCatalog(CatalogScope scope);

    /**
     * A manufacturer with all its modules and inverters, across scopes.
     */
    Mono<EquipmentCatalog> loadCatalogByManufacturer(String manufacturerId);

    /**
     * Upserts every entity of the catalog, reserving names and models as the single-entity mutations do.
     * Not atomic: a failure can leave earlier writes applied.
     */
    Mono<Void> saveCatalog(EquipmentCatalog catalog);

    Mono<Manufacturer> addManufacturer(Manufacturer manufacturer);

    Mono<Manufacturer> updateManufacturer(Manufacturer manufacturer);

    Mono<Void> deleteManufacturer(String manufacturerId);

    Mono<SolarModule> addModule(SolarModule module);

    Mono<SolarModule> updateModule(SolarModule module);

    Mono<Void> deleteModule(String moduleId);

    Mono<Inverter> addInverter(Inverter inverter);

    Mono<Inverter> updateInverter(Inverter inverter);

    Mono<Void> deleteInverter(String inverterId);

    Mono<Manufacturer> findManufacturerById(String id);

    Mono<Manufacturer> findManufacturerByName(String name, String teamId);

    Flux<Manufacturer> findManufacturersByType(ManufacturerType type, String teamId);

    Flux<Manufacturer> findAccessibleManufacturers(String teamId);

    Flux<Manufacturer> findDefaultManufacturers();

    Mono<SolarModule> findModuleById(String id);

    Mono<Inverter> findInverterById(String id);

    Flux<SolarModule> findModulesByManufacturer(String manufacturerId, String teamId);

    Flux<Inverter> findInvertersByManufacturer(String manufacturerId, String teamId);

    Mono<Boolean> hasEquipment(String manufacturerId);

    /**
     * Violations in the whole catalog; empty when consistent.
     */
    Mono<List<CatalogViolation>> validateConsistency();

    /**
     * Repairs what a single pass can and persists the result.
     *
     * @return number of entities removed or changed
     */
    Mono<Integer> repairInconsistencies();
}
