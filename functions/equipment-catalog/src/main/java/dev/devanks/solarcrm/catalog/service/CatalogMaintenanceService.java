package dev.devanks.solarcrm.catalog.service;

import dev.devanks.solarcrm.catalog.aggregate.CatalogViolation;
import dev.devanks.solarcrm.catalog.config.CatalogProperties;
import dev.devanks.solarcrm.catalog.repository.EquipmentCatalogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogMaintenanceService {

    private final EquipmentCatalogRepository catalogRepository;
    private final CatalogProperties properties;

    /**
     * Checks the whole catalog and summarises the violations found.
     *
     * @return a Mono emitting a human-readable summary; storage failures become an error summary
     */
    public Mono<String> validateCatalog() {
        log.info("Starting catalog consistency check.");
        return catalogRepository.validateConsistency()
                .map(this::summarise)
                .doOnNext(summary -> log.info("Catalog consistency check finished: {}", summary))
                .onErrorResume(e -> {
                    log.error("Catalog consistency check failed: {}", e.getMessage(), e);
                    return Mono.just("Error: Catalog validation failed. Details: " + e.getMessage());
                });
    }

    /**
     * Repairs the catalog when repairs are enabled; otherwise reports what a repair would look at.
     *
     * @return a Mono emitting a human-readable summary; storage failures become an error summary
     */
    public Mono<String> repairCatalog() {
        if (!properties.getMaintenance().isRepairEnabled()) {
            log.warn("Catalog repair requested but repairs are disabled. Running as dry run.");
            return validateCatalog().map(summary -> "Dry run (repair disabled). " + summary);
        }
        log.info("Starting catalog repair.");
        return catalogRepository.repairInconsistencies()
                .map(repaired -> "Catalog repair completed. Repaired " + repaired + " entities.")
                .doOnNext(summary -> log.info(summary))
                .onErrorResume(e -> {
                    log.error("Catalog repair failed: {}", e.getMessage(), e);
                    return Mono.just("Error: Catalog repair failed. Details: " + e.getMessage());
                });
    }

    private String summarise(List<CatalogViolation> violations) {
        if (violations.isEmpty()) {
            return "Catalog is consistent. Found 0 violations.";
        }
        return "Found " + violations.size() + " violations: " + violations.stream()
                .map(violation -> "[" + violation.getType() + "] " + violation.getMessage())
                .collect(Collectors.joining("; "));
    }
}
