package dev.devanks.solarcrm.catalog.repository;

import dev.devanks.solarcrm.catalog.aggregate.CatalogResult;
import dev.devanks.solarcrm.catalog.aggregate.CatalogViolation;
import dev.devanks.solarcrm.catalog.aggregate.EquipmentCatalog;
import dev.devanks.solarcrm.catalog.aggregate.RepairReport;
import dev.devanks.solarcrm.catalog.aggregate.ViolationType;
import dev.devanks.solarcrm.catalog.exception.CatalogEntityNotFoundException;
import dev.devanks.solarcrm.catalog.exception.CatalogPersistenceException;
import dev.devanks.solarcrm.catalog.exception.CatalogRuleViolationException;
import dev.devanks.solarcrm.catalog.model.CatalogScope;
import dev.devanks.solarcrm.catalog.model.Inverter;
import dev.devanks.solarcrm.catalog.model.InverterFilter;
import dev.devanks.solarcrm.catalog.model.Manufacturer;
import dev.devanks.solarcrm.catalog.model.ManufacturerFilter;
import dev.devanks.solarcrm.catalog.model.ManufacturerType;
import dev.devanks.solarcrm.catalog.model.SolarModule;
import dev.devanks.solarcrm.catalog.model.SolarModuleFilter;
import dev.devanks.solarcrm.catalog.repository.core.GenericRepository;
import dev.devanks.solarcrm.catalog.repository.unique.UniqueKey;
import dev.devanks.solarcrm.catalog.repository.unique.UniqueKeyRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.springframework.util.StringUtils.hasText;

/**
 * {@link EquipmentCatalogRepository} over the three Firestore collections.
 * <p>
 * Every operation loads the catalog afresh. Mutations of public entities, and all deletes, check the rules
 * against the whole catalog; mutations of team entities against what the team can see.
 */
@Slf4j
public class FirestoreEquipmentCatalogRepository implements EquipmentCatalogRepository {

    private final ManufacturerRepository manufacturers;
    private final SolarModuleRepository modules;
    private final InverterRepository inverters;
    private final UniqueKeyRegistry uniqueKeys;
    private final Duration loadTimeout;

    public FirestoreEquipmentCatalogRepository(ManufacturerRepository manufacturers,
                                               SolarModuleRepository modules,
                                               InverterRepository inverters,
                                               UniqueKeyRegistry uniqueKeys,
                                               Duration loadTimeout) {
        this.manufacturers = manufacturers;
        this.modules = modules;
        this.inverters = inverters;
        this.uniqueKeys = uniqueKeys;
        this.loadTimeout = loadTimeout;
    }

    @Override
    public Mono<EquipmentCatalog> loadCatalog(CatalogScope scope) {
        return Mono.zip(
                        manufacturers.findByFilters(ManufacturerFilter.builder().scope(scope).build()).collectList(),
                        modules.findByFilters(SolarModuleFilter.builder().scope(scope).build()).collectList(),
                        inverters.findByFilters(InverterFilter.builder().scope(scope).build()).collectList())
                .map(loaded -> EquipmentCatalog.of(loaded.getT1(), loaded.getT2(), loaded.getT3()))
                .timeout(loadTimeout)
                .doOnSuccess(catalog -> log.debug("Loaded equipment catalog for scope {}", scope))
                .doOnError(e -> log.error("Error loading equipment catalog for scope {}: {}", scope, e.getMessage(), e))
                .onErrorMap(e -> new CatalogPersistenceException("Failed to load equipment catalog: " + e.getMessage(), e));
    }

    @Override
    public Mono<EquipmentCatalog> loadCatalogByManufacturer(String manufacturerId) {
        return manufacturers.findById(manufacturerId)
                .switchIfEmpty(Mono.error(() -> new CatalogEntityNotFoundException("Manufacturer", manufacturerId)))
                .flatMap(manufacturer -> Mono.zip(
                                modules.findByManufacturer(manufacturer.getId(), CatalogScope.all()).collectList(),
                                inverters.findByManufacturer(manufacturer.getId(), CatalogScope.all()).collectList())
                        .map(loaded -> EquipmentCatalog.of(List.of(manufacturer), loaded.getT1(), loaded.getT2())))
                .timeout(loadTimeout);
    }

    @Override
    public Mono<Void> saveCatalog(EquipmentCatalog catalog) {
        return Mono.when(
                        upsertAll(catalog.getManufacturers(), Manufacturer::getId, UniqueKey::manufacturerName, manufacturers),
                        upsertAll(catalog.getModules(), SolarModule::getId, UniqueKey::moduleModel, modules),
                        upsertAll(catalog.getInverters(), Inverter::getId, UniqueKey::inverterModel, inverters))
                .doOnSuccess(v -> log.info("Saved equipment catalog: {} manufacturers, {} modules, {} inverters",
                        catalog.getManufacturers().size(), catalog.getModules().size(), catalog.getInverters().size()))
                .doOnError(e -> log.error("Error saving equipment catalog, earlier writes are not rolled back: {}",
                        e.getMessage(), e));
    }

    /**
     * Creates or updates each item, reserving its key on create and moving it when an update changes it.
     */
    private <E> Mono<Void> upsertAll(List<E> items, Function<E, String> id, Function<E, UniqueKey> key,
                                     GenericRepository<E, ?> repository) {
        return Flux.fromIterable(items)
                .concatMap(item -> repository.findById(id.apply(item))
                        .map(Optional::of)
                        .defaultIfEmpty(Optional.empty())
                        .flatMap(stored -> stored.isPresent()
                                ? rekeyAndWrite(key.apply(stored.get()), key.apply(item), id.apply(item),
                                () -> repository.update(item))
                                : reserveAndWrite(key.apply(item), id.apply(item), () -> repository.create(item))))
                .then();
    }

    // Manufacturers

    @Override
    public Mono<Manufacturer> addManufacturer(Manufacturer manufacturer) {
        Manufacturer candidate = hasText(manufacturer.getId())
                ? manufacturer
                : manufacturer.toBuilder().id(UUID.randomUUID().toString()).build();
        return loadCatalog(mutationScope(candidate.getScope()))
                .flatMap(catalog -> check(catalog.addManufacturer(candidate), "Manufacturer"))
                .flatMap(catalog -> reserveAndWrite(UniqueKey.manufacturerName(candidate), candidate.getId(),
                        () -> manufacturers.create(candidate)))
                .doOnSuccess(created -> log.info("Added manufacturer {} ({})", created.getName(), created.getId()));
    }

    @Override
    public Mono<Manufacturer> updateManufacturer(Manufacturer manufacturer) {
        return loadCatalog(mutationScope(manufacturer.getScope()))
                .flatMap(catalog -> {
                    Optional<Manufacturer> existing = catalog.findManufacturer(manufacturer.getId());
                    return check(catalog.updateManufacturer(manufacturer), "Manufacturer")
                            .flatMap(updated -> rekeyAndWrite(
                                    existing.map(UniqueKey::manufacturerName).orElse(null),
                                    UniqueKey.manufacturerName(manufacturer),
                                    manufacturer.getId(),
                                    () -> manufacturers.update(manufacturer)));
                })
                .doOnSuccess(updated -> log.info("Updated manufacturer {}", updated.getId()));
    }

    @Override
    public Mono<Void> deleteManufacturer(String manufacturerId) {
        return loadCatalog(CatalogScope.all())
                .flatMap(catalog -> {
                    Optional<Manufacturer> existing = catalog.findManufacturer(manufacturerId);
                    return check(catalog.deleteManufacturer(manufacturerId), "Manufacturer")
                            .flatMap(updated -> manufacturers.delete(manufacturerId))
                            .then(Mono.justOrEmpty(existing)
                                    .flatMap(deleted -> uniqueKeys.release(UniqueKey.manufacturerName(deleted))));
                })
                .doOnSuccess(v -> log.info("Deleted manufacturer {}", manufacturerId));
    }

    // Solar modules

    @Override
    public Mono<SolarModule> addModule(SolarModule module) {
        SolarModule candidate = hasText(module.getId())
                ? module
                : module.toBuilder().id(UUID.randomUUID().toString()).build();
        return loadCatalog(mutationScope(candidate.getScope()))
                .flatMap(catalog -> check(catalog.addModule(candidate), "Solar module"))
                .flatMap(catalog -> reserveAndWrite(UniqueKey.moduleModel(candidate), candidate.getId(),
                        () -> modules.create(candidate)))
                .doOnSuccess(created -> log.info("Added solar module {} ({})", created.getModel(), created.getId()));
    }

    @Override
    public Mono<SolarModule> updateModule(SolarModule module) {
        return loadCatalog(mutationScope(module.getScope()))
                .flatMap(catalog -> {
                    Optional<SolarModule> existing = catalog.findModule(module.getId());
                    return check(catalog.updateModule(module), "Solar module")
                            .flatMap(updated -> rekeyAndWrite(
                                    existing.map(UniqueKey::moduleModel).orElse(null),
                                    UniqueKey.moduleModel(module),
                                    module.getId(),
                                    () -> modules.update(module)));
                })
                .doOnSuccess(updated -> log.info("Updated solar module {}", updated.getId()));
    }

    @Override
    public Mono<Void> deleteModule(String moduleId) {
        return loadCatalog(CatalogScope.all())
                .flatMap(catalog -> {
                    Optional<SolarModule> existing = catalog.findModule(moduleId);
                    return check(catalog.deleteModule(moduleId), "Solar module")
                            .flatMap(updated -> modules.delete(moduleId))
                            .then(Mono.justOrEmpty(existing)
                                    .flatMap(deleted -> uniqueKeys.release(UniqueKey.moduleModel(deleted))));
                })
                .doOnSuccess(v -> log.info("Deleted solar module {}", moduleId));
    }

    // Inverters

    @Override
    public Mono<Inverter> addInverter(Inverter inverter) {
        Inverter candidate = hasText(inverter.getId())
                ? inverter
                : inverter.toBuilder().id(UUID.randomUUID().toString()).build();
        return loadCatalog(mutationScope(candidate.getScope()))
                .flatMap(catalog -> check(catalog.addInverter(candidate), "Inverter"))
                .flatMap(catalog -> reserveAndWrite(UniqueKey.inverterModel(candidate), candidate.getId(),
                        () -> inverters.create(candidate)))
                .doOnSuccess(created -> log.info("Added inverter {} ({})", created.getModel(), created.getId()));
    }

    @Override
    public Mono<Inverter> updateInverter(Inverter inverter) {
        return loadCatalog(mutationScope(inverter.getScope()))
                .flatMap(catalog -> {
                    Optional<Inverter> existing = catalog.findInverter(inverter.getId());
                    return check(catalog.updateInverter(inverter), "Inverter")
                            .flatMap(updated -> rekeyAndWrite(
                                    existing.map(UniqueKey::inverterModel).orElse(null),
                                    UniqueKey.inverterModel(inverter),
                                    inverter.getId(),
                                    () -> inverters.update(inverter)));
                })
                .doOnSuccess(updated -> log.info("Updated inverter {}", updated.getId()));
    }

    @Override
    public Mono<Void> deleteInverter(String inverterId) {
        return loadCatalog(CatalogScope.all())
                .flatMap(catalog -> {
                    Optional<Inverter> existing = catalog.findInverter(inverterId);
                    return check(catalog.deleteInverter(inverterId), "Inverter")
                            .flatMap(updated -> inverters.delete(inverterId))
                            .then(Mono.justOrEmpty(existing)
                                    .flatMap(deleted -> uniqueKeys.release(UniqueKey.inverterModel(deleted))));
                })
                .doOnSuccess(v -> log.info("Deleted inverter {}", inverterId));
    }

    // Queries

    @Override
    public Mono<Manufacturer> findManufacturerById(String id) {
        return manufacturers.findById(id);
    }

    @Override
    public Mono<Manufacturer> findManufacturerByName(String name, String teamId) {
        return manufacturers.findByName(name, teamId);
    }

    @Override
    public Flux<Manufacturer> findManufacturersByType(ManufacturerType type, String teamId) {
        return manufacturers.findByType(type, teamId);
    }

    @Override
    public Flux<Manufacturer> findAccessibleManufacturers(String teamId) {
        return manufacturers.findAccessible(teamId);
    }

    @Override
    public Flux<Manufacturer> findDefaultManufacturers() {
        return manufacturers.findDefaults();
    }

    @Override
    public Mono<SolarModule> findModuleById(String id) {
        return modules.findById(id);
    }

    @Override
    public Mono<Inverter> findInverterById(String id) {
        return inverters.findById(id);
    }

    @Override
    public Flux<SolarModule> findModulesByManufacturer(String manufacturerId, String teamId) {
        return modules.findByManufacturer(manufacturerId, CatalogScope.team(teamId));
    }

    @Override
    public Flux<Inverter> findInvertersByManufacturer(String manufacturerId, String teamId) {
        return inverters.findByManufacturer(manufacturerId, CatalogScope.team(teamId));
    }

    @Override
    public Mono<Boolean> hasEquipment(String manufacturerId) {
        return Mono.zip(
                        modules.findByManufacturer(manufacturerId, CatalogScope.all()).hasElements(),
                        inverters.findByManufacturer(manufacturerId, CatalogScope.all()).hasElements())
                .map(found -> found.getT1() || found.getT2());
    }

    // Consistency

    @Override
    public Mono<List<CatalogViolation>> validateConsistency() {
        return loadCatalog(CatalogScope.all())
                .map(EquipmentCatalog::validateConsistency)
                .doOnSuccess(violations -> log.info("Catalog consistency check found {} violations", violations.size()));
    }

    @Override
    public Mono<Integer> repairInconsistencies() {
        return loadCatalog(CatalogScope.all())
                .flatMap(catalog -> {
                    RepairReport report = catalog.repairInconsistencies();
                    if (report.getRepairedCount() == 0) {
                        log.info("Catalog repair found nothing to repair, {} violations left unresolved",
                                report.getUnresolvedViolations().size());
                        return Mono.just(0);
                    }
                    Flux<Void> removeModules = Flux.fromIterable(report.getRemovedModuleIds())
                            .concatMap(id -> modules.softDelete(id)
                                    .then(Mono.justOrEmpty(catalog.findModule(id))
                                            .flatMap(removed -> uniqueKeys.release(UniqueKey.moduleModel(removed)))));
                    Flux<Void> removeInverters = Flux.fromIterable(report.getRemovedInverterIds())
                            .concatMap(id -> inverters.softDelete(id)
                                    .then(Mono.justOrEmpty(catalog.findInverter(id))
                                            .flatMap(removed -> uniqueKeys.release(UniqueKey.inverterModel(removed)))));
                    return removeModules.thenMany(removeInverters)
                            .then(saveCatalog(report.getCatalog()))
                            .doOnSuccess(v -> log.info("Catalog repair applied {} changes, {} violations remain",
                                    report.getRepairedCount(), report.getRemainingViolations().size()))
                            .thenReturn(report.getRepairedCount());
                });
    }

    // Helpers

    /**
     * Public entities can clash with any team's data, so their rules are checked against everything.
     */
    private static CatalogScope mutationScope(String entityScope) {
        return CatalogScope.isPublic(entityScope) ? CatalogScope.all() : CatalogScope.team(entityScope);
    }

    private static Mono<EquipmentCatalog> check(CatalogResult<EquipmentCatalog> result, String entityName) {
        if (result.isSuccess()) {
            return Mono.just(result.getValue());
        }
        CatalogViolation violation = result.getViolation();
        log.warn("Rejected {} change: {} ({})", entityName, violation.getMessage(), violation.getType());
        if (violation.getType() == ViolationType.NOT_FOUND) {
            return Mono.error(new CatalogEntityNotFoundException(entityName, violation.getEntityId()));
        }
        return Mono.error(new CatalogRuleViolationException(violation));
    }

    /**
     * Reserves the key, then writes. A failed write frees the key again.
     */
    private <T> Mono<T> reserveAndWrite(UniqueKey key, String ownerId, Supplier<Mono<T>> write) {
        return uniqueKeys.reserve(key, ownerId)
                .then(Mono.defer(() -> write.get()
                        .onErrorResume(e -> releaseQuietly(key).then(Mono.error(e)))));
    }

    /**
     * Write for an update: an unchanged key is left alone, a changed one is swapped around the write.
     */
    private <T> Mono<T> rekeyAndWrite(UniqueKey previous, UniqueKey next, String ownerId,
                                      Supplier<Mono<T>> write) {
        if (next.equals(previous)) {
            return Mono.defer(write);
        }
        return reserveAndWrite(next, ownerId, write)
                .flatMap(written -> previous == null
                        ? Mono.just(written)
                        : uniqueKeys.release(previous).thenReturn(written));
    }

    private Mono<Void> releaseQuietly(UniqueKey key) {
        return uniqueKeys.release(key)
                .onErrorResume(e -> {
                    log.error("Failed to release {} after a failed write: {}", key, e.getMessage(), e);
                    return Mono.empty();
                });
    }
}
