package dev.devanks.solarcrm.catalog.mapper;

import dev.devanks.solarcrm.catalog.entity.SolarModuleEntity;
import dev.devanks.solarcrm.catalog.model.SolarModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SolarModuleMapperTest {

    private final SolarModuleMapper solarModuleMapper = new SolarModuleMapper();

    @Test
    @DisplayName("toDomain - sparse document")
    void toDomain_SparseDocument() {
        // Arrange
        SolarModuleEntity document = SolarModuleEntity.builder()
                .id("mod-1")
                .manufacturerId("m-1")
                .model("Vertex S+")
                .scope("public")
                .build();

        // Act
        SolarModule module = solarModuleMapper.toDomain(document);

        // Assert
        assertThat(module.getNominalPowerW()).isZero();
        assertThat(module.getCertifications()).isEmpty();
        assertThat(module.getDiodeModel()).isNull();
    }

    @Test
    @DisplayName("toDomain - certifications are copied")
    void toDomain_CopiesCertifications() {
        // Arrange
        List<String> certifications = new ArrayList<>(List.of("IEC 61215", "IEC 61730"));
        SolarModuleEntity document = SolarModuleEntity.builder()
                .id("mod-1")
                .nominalPowerW(430.0)
                .certifications(certifications)
                .build();

        // Act
        SolarModule module = solarModuleMapper.toDomain(document);
        certifications.clear();

        // Assert
        assertThat(module.getNominalPowerW()).isEqualTo(430.0);
        assertThat(module.getCertifications()).containsExactly("IEC 61215", "IEC 61730");
    }
}
