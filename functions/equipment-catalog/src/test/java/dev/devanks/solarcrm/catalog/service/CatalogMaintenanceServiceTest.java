package dev.devanks.solarcrm.catalog.service;

import dev.devanks.solarcrm.catalog.aggregate.CatalogViolation;
import dev.devanks.solarcrm.catalog.aggregate.ViolationType;
import dev.devanks.solarcrm.catalog.config.CatalogProperties;
import dev.devanks.solarcrm.catalog.exception.CatalogPersistenceException;
import dev.devanks.solarcrm.catalog.repository.EquipmentCatalogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CatalogMaintenanceService Unit Tests")
class CatalogMaintenanceServiceTest {

    @Mock
    private EquipmentCatalogRepository mockCatalogRepository;

    private CatalogProperties properties;
    private CatalogMaintenanceService maintenanceService;

    @BeforeEach
    void setUp() {
        properties = new CatalogProperties();
        maintenanceService = new CatalogMaintenanceService(mockCatalogRepository, properties);
    }

    @Test
    @DisplayName("validateCatalog: consistent catalog")
    void validateCatalog_consistent() {
        // Arrange
        when(mockCatalogRepository.validateConsistency()).thenReturn(Mono.just(List.of()));

        // Act & Assert
        StepVerifier.create(maintenanceService.validateCatalog())
                .expectNext("Catalog is consistent. Found 0 violations.")
                .verifyComplete();
    }

    @Test
    @DisplayName("validateCatalog: lists every violation found")
    void validateCatalog_violations() {
        // Arrange
        when(mockCatalogRepository.validateConsistency()).thenReturn(Mono.just(List.of(
                CatalogViolation.of(ViolationType.DANGLING_REFERENCE, "Solar module X references missing manufacturer m-1", "mod-1"),
                CatalogViolation.of(ViolationType.DUPLICATE_NAME, "Manufacturer name Acme is also used by m-2", "m-3"))));

        // Act & Assert
        StepVerifier.create(maintenanceService.validateCatalog())
                .expectNext("Found 2 violations: [DANGLING_REFERENCE] Solar module X references missing manufacturer m-1; "
                        + "[DUPLICATE_NAME] Manufacturer name Acme is also used by m-2")
                .verifyComplete();
    }

    @Test
    @DisplayName("validateCatalog: storage failure becomes an error summary")
    void validateCatalog_failure() {
        // Arrange
        when(mockCatalogRepository.validateConsistency())
                .thenReturn(Mono.error(new CatalogPersistenceException("Failed to load equipment catalog: timeout")));

        // Act & Assert
        StepVerifier.create(maintenanceService.validateCatalog())
                .expectNext("Error: Catalog validation failed. Details: Failed to load equipment catalog: timeout")
                .verifyComplete();
    }

    @Test
    @DisplayName("repairCatalog: repairs disabled, runs a dry run instead")
    void repairCatalog_disabled_dryRun() {
        // Arrange
        when(mockCatalogRepository.validateConsistency()).thenReturn(Mono.just(List.of()));

        // Act & Assert
        StepVerifier.create(maintenanceService.repairCatalog())
                .expectNext("Dry run (repair disabled). Catalog is consistent. Found 0 violations.")
                .verifyComplete();
        verify(mockCatalogRepository, never()).repairInconsistencies();
    }

    @Test
    @DisplayName("repairCatalog: repairs enabled, reports the repaired count")
    void repairCatalog_enabled() {
        // Arrange
        properties.getMaintenance().setRepairEnabled(true);
        when(mockCatalogRepository.repairInconsistencies()).thenReturn(Mono.just(3));

        // Act & Assert
        StepVerifier.create(maintenanceService.repairCatalog())
                .expectNext("Catalog repair completed. Repaired 3 entities.")
                .verifyComplete();
    }

    @Test
    @DisplayName("repairCatalog: failure becomes an error summary")
    void repairCatalog_failure() {
        // Arrange
        properties.getMaintenance().setRepairEnabled(true);
        when(mockCatalogRepository.repairInconsistencies())
                .thenReturn(Mono.error(new CatalogPersistenceException("write rejected")));

        // Act & Assert
        StepVerifier.create(maintenanceService.repairCatalog())
                .expectNext("Error: Catalog repair failed. Details: write rejected")
                .verifyComplete();
    }
}
