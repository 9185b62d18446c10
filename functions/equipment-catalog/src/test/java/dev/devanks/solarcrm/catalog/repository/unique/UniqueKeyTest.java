package dev.devanks.solarcrm.catalog.repository.unique;

import dev.devanks.solarcrm.catalog.aggregate.ViolationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static dev.devanks.solarcrm.catalog.model.ManufacturerType.SOLAR_MODULE;
import static dev.devanks.solarcrm.catalog.support.CatalogFixture.inverter;
import static dev.devanks.solarcrm.catalog.support.CatalogFixture.manufacturer;
import static dev.devanks.solarcrm.catalog.support.CatalogFixture.module;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UniqueKey Unit Tests")
class UniqueKeyTest {

    @Test
    @DisplayName("manufacturer names are normalised before hashing")
    void manufacturerName_normalised() {
        UniqueKey key = UniqueKey.manufacturerName(manufacturer("m-1", "  Trina Solar ", SOLAR_MODULE, "public"));
        UniqueKey other = UniqueKey.manufacturerName(manufacturer("m-2", "TRINA SOLAR", SOLAR_MODULE, "public"));

        assertThat(key.getName()).isEqualTo("trina solar");
        assertThat(key).isEqualTo(other);
        assertThat(key.documentId()).isEqualTo(other.documentId()).hasSize(64);
        assertThat(key.violationType()).isEqualTo(ViolationType.DUPLICATE_NAME);
    }

    @Test
    @DisplayName("scopes keep otherwise equal keys apart")
    void scope_separatesKeys() {
        UniqueKey teamA = UniqueKey.manufacturerName(manufacturer("m-1", "Acme", SOLAR_MODULE, "team-a"));
        UniqueKey teamB = UniqueKey.manufacturerName(manufacturer("m-2", "Acme", SOLAR_MODULE, "team-b"));

        assertThat(teamA.documentId()).isNotEqualTo(teamB.documentId());
    }

    @Test
    @DisplayName("models are keyed per scope and manufacturer")
    void models_keyedPerManufacturer() {
        UniqueKey module = UniqueKey.moduleModel(module("mod-1", "m-1", "Vertex", "public", 400));
        UniqueKey otherManufacturer = UniqueKey.moduleModel(module("mod-2", "m-2", "Vertex", "public", 400));
        UniqueKey inverter = UniqueKey.inverterModel(inverter("inv-1", "m-1", "Vertex", "public", 5000));

        assertThat(module.getScopeKey()).isEqualTo("public/m-1");
        assertThat(module.documentId()).isNotEqualTo(otherManufacturer.documentId());
        assertThat(module.documentId()).isNotEqualTo(inverter.documentId());
        assertThat(inverter.violationType()).isEqualTo(ViolationType.DUPLICATE_MODEL);
    }
}
