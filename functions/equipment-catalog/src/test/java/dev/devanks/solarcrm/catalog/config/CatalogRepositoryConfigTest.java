package dev.devanks.solarcrm.catalog.config;

import com.google.cloud.firestore.Firestore;
import dev.devanks.solarcrm.catalog.entity.ManufacturerEntity;
import dev.devanks.solarcrm.catalog.mapper.ManufacturerMapper;
import dev.devanks.solarcrm.catalog.model.Manufacturer;
import dev.devanks.solarcrm.catalog.model.ManufacturerType;
import dev.devanks.solarcrm.catalog.repository.ManufacturerDocumentRepository;
import dev.devanks.solarcrm.catalog.repository.ManufacturerRepository;
import dev.devanks.solarcrm.catalog.repository.unique.FirestoreUniqueKeyRegistry;
import dev.devanks.solarcrm.catalog.repository.unique.UniqueKey;
import dev.devanks.solarcrm.catalog.repository.unique.UniqueKeyRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Clock;

import static dev.devanks.solarcrm.catalog.support.CatalogFixture.manufacturer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CatalogRepositoryConfig Unit Tests")
class CatalogRepositoryConfigTest {

    @Mock
    private Firestore mockFirestore;
    @Mock
    private ManufacturerDocumentRepository mockManufacturerDocuments;

    private final CatalogRepositoryConfig config = new CatalogRepositoryConfig();

    @Test
    @DisplayName("uniqueKeyRegistry: reservations in Firestore when enabled")
    void uniqueKeyRegistry_enabled() {
        UniqueKeyRegistry registry = config.uniqueKeyRegistry(mockFirestore, new CatalogProperties());

        assertThat(registry).isInstanceOf(FirestoreUniqueKeyRegistry.class);
    }

    @Test
    @DisplayName("uniqueKeyRegistry: a no-op registry when disabled")
    void uniqueKeyRegistry_disabled() {
        CatalogProperties properties = new CatalogProperties();
        properties.getUniqueKeys().setEnabled(false);
        UniqueKey key = UniqueKey.manufacturerName(manufacturer("m-1", "Acme", ManufacturerType.BOTH, "public"));

        UniqueKeyRegistry registry = config.uniqueKeyRegistry(mockFirestore, properties);

        StepVerifier.create(registry.reserve(key, "m-1")).verifyComplete();
        StepVerifier.create(registry.reserve(key, "m-2")).verifyComplete();
        verifyNoInteractions(mockFirestore);
    }

    @Test
    @DisplayName("manufacturerRepository: reads through the document repository, skipping deleted records")
    void manufacturerRepository_readsDocuments() {
        // Arrange
        ManufacturerRepository repository = config.manufacturerRepository(mockManufacturerDocuments,
                new ManufacturerMapper(), new CatalogProperties(), Clock.systemUTC());
        when(mockManufacturerDocuments.findAll()).thenReturn(Flux.just(
                ManufacturerEntity.builder()
                        .id("m-1").name("Acme").type("BOTH").scope("public").isDeleted(false).build(),
                ManufacturerEntity.builder()
                        .id("m-2").name("Gone").type("BOTH").scope("public").isDeleted(true).build()));

        // Act & Assert
        StepVerifier.create(repository.findAccessible(null).map(Manufacturer::getId))
                .expectNext("m-1")
                .verifyComplete();
    }
}
