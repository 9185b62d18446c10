package dev.devanks.solarcrm.catalog.aggregate;

import dev.devanks.solarcrm.catalog.model.Equipment;
import dev.devanks.solarcrm.catalog.model.Inverter;
import dev.devanks.solarcrm.catalog.model.Manufacturer;
import dev.devanks.solarcrm.catalog.model.ManufacturerType;
import dev.devanks.solarcrm.catalog.model.SolarModule;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkArgument;
import static dev.devanks.solarcrm.catalog.aggregate.ViolationType.ALREADY_EXISTS;
import static dev.devanks.solarcrm.catalog.aggregate.ViolationType.DANGLING_REFERENCE;
import static dev.devanks.solarcrm.catalog.aggregate.ViolationType.DUPLICATE_MODEL;
import static dev.devanks.solarcrm.catalog.aggregate.ViolationType.DUPLICATE_NAME;
import static dev.devanks.solarcrm.catalog.aggregate.ViolationType.HAS_DEPENDENTS;
import static dev.devanks.solarcrm.catalog.aggregate.ViolationType.INCOMPATIBLE_MANUFACTURER;
import static dev.devanks.solarcrm.catalog.aggregate.ViolationType.NOT_FOUND;
import static dev.devanks.solarcrm.catalog.aggregate.ViolationType.PROTECTED_DEFAULT;
import static org.springframework.util.StringUtils.hasText;

/**
 * In-memory view of manufacturers, solar modules and inverters that enforces the rules spanning them:
 * <ul>
 *     <li>equipment references an existing manufacturer visible from the equipment's scope;</li>
 *     <li>manufacturer names are unique (ignoring case) within a scope, public names across all scopes;</li>
 *     <li>a manufacturer with equipment, or a default manufacturer, cannot be deleted;</li>
 *     <li>equipment models are unique (ignoring case) per scope and manufacturer;</li>
 *     <li>a manufacturer only holds equipment of a kind it produces.</li>
 * </ul>
 * Instances are immutable. Mutators return a new catalog on success and never throw for rule violations.
 * Entities must carry an id before they are added; the repository assigns one.
 */
@EqualsAndHashCode
@ToString
public final class EquipmentCatalog {

    private static final EquipmentCatalog EMPTY = new EquipmentCatalog(Map.of(), Map.of(), Map.of());

    private final Map<String, Manufacturer> manufacturers;
    private final Map<String, SolarModule> modules;
    private final Map<String, Inverter> inverters;

    private EquipmentCatalog(Map<String, Manufacturer> manufacturers,
                             Map<String, SolarModule> modules,
                             Map<String, Inverter> inverters) {
        this.manufacturers = Collections.unmodifiableMap(new LinkedHashMap<>(manufacturers));
        this.modules = Collections.unmodifiableMap(new LinkedHashMap<>(modules));
        this.inverters = Collections.unmodifiableMap(new LinkedHashMap<>(inverters));
    }

    public static EquipmentCatalog empty() {
        return EMPTY;
    }

    /**
     * Builds a catalog from stored entities as they are; use {@link #validateConsistency()} to check them.
     */
    public static EquipmentCatalog of(Collection<Manufacturer> manufacturers,
                                      Collection<SolarModule> modules,
                                      Collection<Inverter> inverters) {
        return new EquipmentCatalog(
                index(manufacturers, Manufacturer::getId),
                index(modules, SolarModule::getId),
                index(inverters, Inverter::getId));
    }

    private static <T> Map<String, T> index(Collection<T> items, Function<T, String> id) {
        Map<String, T> indexed = new LinkedHashMap<>();
        items.forEach(item -> indexed.put(id.apply(item), item));
        return indexed;
    }

    // Manufacturers

    public CatalogResult<EquipmentCatalog> addManufacturer(Manufacturer manufacturer) {
        requireId(manufacturer.getId(), "Manufacturer");
        if (manufacturers.containsKey(manufacturer.getId())) {
            return CatalogResult.failure(ALREADY_EXISTS,
                    "Manufacturer already exists in catalog: " + manufacturer.getId(), manufacturer.getId());
        }
        if (findNameConflict(manufacturer).isPresent()) {
            return duplicateName(manufacturer);
        }
        return CatalogResult.success(withManufacturer(manufacturer));
    }

    /**
     * Replaces a manufacturer. Narrowing its type, or moving it out of reach of its equipment, is rejected.
     */
    public CatalogResult<EquipmentCatalog> updateManufacturer(Manufacturer manufacturer) {
        requireId(manufacturer.getId(), "Manufacturer");
        if (!manufacturers.containsKey(manufacturer.getId())) {
            return notFound("Manufacturer", manufacturer.getId());
        }
        if (findNameConflict(manufacturer).isPresent()) {
            return duplicateName(manufacturer);
        }
        for (Equipment item : equipmentOf(manufacturer.getId())) {
            if (!manufacturer.canProduce(item.kind())) {
                return CatalogResult.failure(INCOMPATIBLE_MANUFACTURER,
                        "Manufacturer " + manufacturer.getName() + " must keep producing "
                                + item.kind().displayName() + "s, it still has " + item.getModel(),
                        manufacturer.getId());
            }
            if (!isVisible(manufacturer, item)) {
                return CatalogResult.failure(DANGLING_REFERENCE,
                        "Manufacturer " + manufacturer.getName() + " would no longer be visible to "
                                + item.getModel(),
                        manufacturer.getId());
            }
        }
        return CatalogResult.success(withManufacturer(manufacturer));
    }

    public CatalogResult<EquipmentCatalog> deleteManufacturer(String manufacturerId) {
        Manufacturer manufacturer = manufacturers.get(manufacturerId);
        if (manufacturer == null) {
            return notFound("Manufacturer", manufacturerId);
        }
        if (hasEquipment(manufacturerId)) {
            return CatalogResult.failure(HAS_DEPENDENTS,
                    "Cannot delete manufacturer with associated equipment. "
                            + "Delete or reassign all modules and inverters first.",
                    manufacturerId);
        }
        if (manufacturer.isDefault()) {
            return CatalogResult.failure(PROTECTED_DEFAULT, "Cannot delete default manufacturers", manufacturerId);
        }
        var remaining = new LinkedHashMap<>(manufacturers);
        remaining.remove(manufacturerId);
        return CatalogResult.success(new EquipmentCatalog(remaining, modules, inverters));
    }

    // Solar modules

    public CatalogResult<EquipmentCatalog> addModule(SolarModule module) {
        requireId(module.getId(), "Solar module");
        if (modules.containsKey(module.getId())) {
            return CatalogResult.failure(ALREADY_EXISTS,
                    "Module already exists in catalog: " + module.getId(), module.getId());
        }
        return checkEquipment(module, modules.values())
                .map(ignored -> withModule(module));
    }

    public CatalogResult<EquipmentCatalog> updateModule(SolarModule module) {
        requireId(module.getId(), "Solar module");
        if (!modules.containsKey(module.getId())) {
            return notFound("Module", module.getId());
        }
        return checkEquipment(module, modules.values())
                .map(ignored -> withModule(module));
    }

    public CatalogResult<EquipmentCatalog> deleteModule(String moduleId) {
        if (!modules.containsKey(moduleId)) {
            return notFound("Module", moduleId);
        }
        var remaining = new LinkedHashMap<>(modules);
        remaining.remove(moduleId);
        return CatalogResult.success(new EquipmentCatalog(manufacturers, remaining, inverters));
    }

    // Inverters

    public CatalogResult<EquipmentCatalog> addInverter(Inverter inverter) {
        requireId(inverter.getId(), "Inverter");
        if (inverters.containsKey(inverter.getId())) {
            return CatalogResult.failure(ALREADY_EXISTS,
                    "Inverter already exists in catalog: " + inverter.getId(), inverter.getId());
        }
        return checkEquipment(inverter, inverters.values())
                .map(ignored -> withInverter(inverter));
    }

    public CatalogResult<EquipmentCatalog> updateInverter(Inverter inverter) {
        requireId(inverter.getId(), "Inverter");
        if (!inverters.containsKey(inverter.getId())) {
            return notFound("Inverter", inverter.getId());
        }
        return checkEquipment(inverter, inverters.values())
                .map(ignored -> withInverter(inverter));
    }

    public CatalogResult<EquipmentCatalog> deleteInverter(String inverterId) {
        if (!inverters.containsKey(inverterId)) {
            return notFound("Inverter", inverterId);
        }
        var remaining = new LinkedHashMap<>(inverters);
        remaining.remove(inverterId);
        return CatalogResult.success(new EquipmentCatalog(manufacturers, modules, remaining));
    }

    // Queries

    public Optional<Manufacturer> findManufacturer(String id) {
        return Optional.ofNullable(id == null ? null : manufacturers.get(id));
    }

    public Optional<SolarModule> findModule(String id) {
        return Optional.ofNullable(id == null ? null : modules.get(id));
    }

    public Optional<Inverter> findInverter(String id) {
        return Optional.ofNullable(id == null ? null : inverters.get(id));
    }

    public List<Manufacturer> getManufacturers() {
        return List.copyOf(manufacturers.values());
    }

    public List<SolarModule> getModules() {
        return List.copyOf(modules.values());
    }

    public List<Inverter> getInverters() {
        return List.copyOf(inverters.values());
    }

    public List<SolarModule> modulesOf(String manufacturerId) {
        return modules.values().stream()
                .filter(module -> Objects.equals(module.getManufacturerId(), manufacturerId))
                .toList();
    }

    public List<Inverter> invertersOf(String manufacturerId) {
        return inverters.values().stream()
                .filter(inverter -> Objects.equals(inverter.getManufacturerId(), manufacturerId))
                .toList();
    }

    public int equipmentCount(String manufacturerId) {
        return modulesOf(manufacturerId).size() + invertersOf(manufacturerId).size();
    }

    public boolean hasEquipment(String manufacturerId) {
        return equipmentCount(manufacturerId) > 0;
    }

    public boolean isEmpty() {
        return manufacturers.isEmpty() && modules.isEmpty() && inverters.isEmpty();
    }

    // Consistency

    /**
     * Checks stored data against the catalog rules. An empty list means the catalog is consistent.
     */
    public List<CatalogViolation> validateConsistency() {
        List<CatalogViolation> violations = new ArrayList<>();
        allEquipment().forEach(item -> {
            Manufacturer manufacturer = manufacturers.get(item.getManufacturerId());
            if (manufacturer == null || !isVisible(manufacturer, item)) {
                violations.add(CatalogViolation.of(DANGLING_REFERENCE,
                        describe(item) + " references missing manufacturer " + item.getManufacturerId(),
                        item.getId()));
            } else if (!manufacturer.canProduce(item.kind())) {
                violations.add(CatalogViolation.of(INCOMPATIBLE_MANUFACTURER,
                        "Manufacturer " + manufacturer.getName() + " cannot produce "
                                + item.kind().displayName() + "s but has " + describe(item),
                        manufacturer.getId()));
            }
        });

        List<Manufacturer> seen = new ArrayList<>();
        for (Manufacturer manufacturer : manufacturers.values()) {
            seen.stream()
                    .filter(earlier -> namesConflict(manufacturer, earlier))
                    .findFirst()
                    .ifPresent(earlier -> violations.add(CatalogViolation.of(DUPLICATE_NAME,
                            "Manufacturer name " + manufacturer.getName() + " is also used by " + earlier.getId(),
                            manufacturer.getId())));
            seen.add(manufacturer);
        }
        return violations;
    }

    /**
     * One repair pass over the violations present now. Dangling equipment is dropped and manufacturers holding
     * equipment they cannot produce are widened to {@link ManufacturerType#BOTH}. Duplicate names are left
     * for a person to resolve.
     */
    public RepairReport repairInconsistencies() {
        List<CatalogViolation> found = validateConsistency();
        var keptModules = new LinkedHashMap<>(modules);
        var keptInverters = new LinkedHashMap<>(inverters);
        var keptManufacturers = new LinkedHashMap<>(manufacturers);
        List<String> removedModules = new ArrayList<>();
        List<String> removedInverters = new ArrayList<>();
        Set<String> widened = new LinkedHashSet<>();
        List<CatalogViolation> unresolved = new ArrayList<>();

        for (CatalogViolation violation : found) {
            String id = violation.getEntityId();
            switch (violation.getType()) {
                case DANGLING_REFERENCE:
                    if (keptModules.remove(id) != null) {
                        removedModules.add(id);
                    } else if (keptInverters.remove(id) != null) {
                        removedInverters.add(id);
                    }
                    break;
                case INCOMPATIBLE_MANUFACTURER:
                    Manufacturer manufacturer = keptManufacturers.get(id);
                    if (manufacturer != null && widened.add(id)) {
                        keptManufacturers.put(id, manufacturer.toBuilder().type(ManufacturerType.BOTH).build());
                    }
                    break;
                default:
                    unresolved.add(violation);
            }
        }

        EquipmentCatalog repaired = new EquipmentCatalog(keptManufacturers, keptModules, keptInverters);
        return RepairReport.builder()
                .catalog(repaired)
                .repairedCount(removedModules.size() + removedInverters.size() + widened.size())
                .removedModuleIds(removedModules)
                .removedInverterIds(removedInverters)
                .updatedManufacturerIds(widened)
                .unresolvedViolations(unresolved)
                .remainingViolations(repaired.validateConsistency())
                .build();
    }

    // Rule helpers

    private CatalogResult<Void> checkEquipment(Equipment item, Collection<? extends Equipment> sameKind) {
        if (!hasText(item.getManufacturerId())) {
            return CatalogResult.failure(DANGLING_REFERENCE, "Manufacturer id is required", item.getId());
        }
        Manufacturer manufacturer = manufacturers.get(item.getManufacturerId());
        if (manufacturer == null || !isVisible(manufacturer, item)) {
            return CatalogResult.failure(DANGLING_REFERENCE,
                    "Manufacturer not found: " + item.getManufacturerId(), item.getId());
        }
        if (!manufacturer.canProduce(item.kind())) {
            return CatalogResult.failure(INCOMPATIBLE_MANUFACTURER,
                    "Manufacturer " + manufacturer.getName() + " cannot produce " + item.kind().displayName() + "s",
                    item.getId());
        }
        boolean duplicateModel = sameKind.stream()
                .filter(other -> !other.getId().equals(item.getId()))
                .filter(other -> Objects.equals(other.getManufacturerId(), item.getManufacturerId()))
                .filter(other -> Objects.equals(other.getScope(), item.getScope()))
                .anyMatch(other -> other.getModel() != null && other.getModel().equalsIgnoreCase(item.getModel()));
        if (duplicateModel) {
            return CatalogResult.failure(DUPLICATE_MODEL,
                    capitalize(item.kind().displayName()) + " model already exists for this manufacturer: "
                            + item.getModel(),
                    item.getId());
        }
        return CatalogResult.success(null);
    }

    private Optional<Manufacturer> findNameConflict(Manufacturer candidate) {
        return manufacturers.values().stream()
                .filter(existing -> !existing.getId().equals(candidate.getId()))
                .filter(existing -> namesConflict(candidate, existing))
                .findFirst();
    }

    /**
     * Same name ignoring case, and the two would be seen together: one is public or both share a scope.
     */
    private static boolean namesConflict(Manufacturer candidate, Manufacturer existing) {
        return candidate.getName() != null
                && candidate.getName().equalsIgnoreCase(existing.getName())
                && (candidate.isPublic() || existing.isPublic()
                || Objects.equals(candidate.getScope(), existing.getScope()));
    }

    private static boolean isVisible(Manufacturer manufacturer, Equipment item) {
        return manufacturer.isPublic() || Objects.equals(manufacturer.getScope(), item.getScope());
    }

    private List<Equipment> equipmentOf(String manufacturerId) {
        List<Equipment> items = new ArrayList<>(modulesOf(manufacturerId));
        items.addAll(invertersOf(manufacturerId));
        return items;
    }

    private Stream<Equipment> allEquipment() {
        return Stream.concat(modules.values().stream(), inverters.values().stream());
    }

    private EquipmentCatalog withManufacturer(Manufacturer manufacturer) {
        var updated = new LinkedHashMap<>(manufacturers);
        updated.put(manufacturer.getId(), manufacturer);
        return new EquipmentCatalog(updated, modules, inverters);
    }

    private EquipmentCatalog withModule(SolarModule module) {
        var updated = new LinkedHashMap<>(modules);
        updated.put(module.getId(), module);
        return new EquipmentCatalog(manufacturers, updated, inverters);
    }

    private EquipmentCatalog withInverter(Inverter inverter) {
        var updated = new LinkedHashMap<>(inverters);
        updated.put(inverter.getId(), inverter);
        return new EquipmentCatalog(manufacturers, modules, updated);
    }

    private static <T> CatalogResult<T> notFound(String entity, String id) {
        return CatalogResult.failure(NOT_FOUND, entity + " not found: " + id, id);
    }

    private static <T> CatalogResult<T> duplicateName(Manufacturer manufacturer) {
        return CatalogResult.failure(DUPLICATE_NAME,
                "Manufacturer with this name already exists: " + manufacturer.getName(), manufacturer.getId());
    }

    private static void requireId(String id, String entity) {
        checkArgument(hasText(id), "%s must have an id before it is added to the catalog", entity);
    }

    private static String describe(Equipment item) {
        return capitalize(item.kind().displayName()) + " " + item.getModel();
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
