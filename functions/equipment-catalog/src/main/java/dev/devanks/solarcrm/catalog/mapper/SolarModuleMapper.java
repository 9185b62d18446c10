package dev.devanks.solarcrm.catalog.mapper;

import dev.devanks.solarcrm.catalog.entity.SolarModuleEntity;
import dev.devanks.solarcrm.catalog.model.SolarModule;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class SolarModuleMapper implements EntityMapper<SolarModule, SolarModuleEntity> {

    @Override
    public SolarModule toDomain(SolarModuleEntity document) {
        return SolarModule.builder()
                .id(document.getId())
                .manufacturerId(document.getManufacturerId())
                .scope(document.getScope())
                .model(document.getModel())
                .nominalPowerW(document.getNominalPowerW() == null ? 0.0 : document.getNominalPowerW())
                .cellType(document.getCellType())
                .efficiencyPercent(document.getEfficiencyPercent())
                .cellCount(document.getCellCount())
                .widthMm(document.getWidthMm())
                .heightMm(document.getHeightMm())
                .thicknessMm(document.getThicknessMm())
                .weightKg(document.getWeightKg())
                .vmpp(document.getVmpp())
                .impp(document.getImpp())
                .voc(document.getVoc())
                .isc(document.getIsc())
                .tempCoefPmax(document.getTempCoefPmax())
                .tempCoefVoc(document.getTempCoefVoc())
                .tempCoefIsc(document.getTempCoefIsc())
                .material(document.getMaterial())
                .technology(document.getTechnology())
                .warrantyYears(document.getWarrantyYears())
                .tolerance(document.getTolerance())
                .datasheetUrl(document.getDatasheetUrl())
                .certifications(document.getCertifications() == null ? List.of() : List.copyOf(document.getCertifications()))
                .diodeModel(document.getDiodeModel())
                .thermalModel(document.getThermalModel())
                .createdAt(document.getCreatedAt())
                .updatedAt(document.getUpdatedAt())
                .build();
    }

    @Override
    public SolarModuleEntity toPersistence(SolarModule entity) {
        return SolarModuleEntity.builder()
                .id(entity.getId())
                .manufacturerId(entity.getManufacturerId())
                .scope(entity.getScope())
                .model(entity.getModel())
                .nominalPowerW(entity.getNominalPowerW())
                .cellType(entity.getCellType())
                .efficiencyPercent(entity.getEfficiencyPercent())
                .cellCount(entity.getCellCount())
                .widthMm(entity.getWidthMm())
                .heightMm(entity.getHeightMm())
                .thicknessMm(entity.getThicknessMm())
                .weightKg(entity.getWeightKg())
                .vmpp(entity.getVmpp())
                .impp(entity.getImpp())
                .voc(entity.getVoc())
                .isc(entity.getIsc())
                .tempCoefPmax(entity.getTempCoefPmax())
                .tempCoefVoc(entity.getTempCoefVoc())
                .tempCoefIsc(entity.getTempCoefIsc())
                .material(entity.getMaterial())
                .technology(entity.getTechnology())
                .warrantyYears(entity.getWarrantyYears())
                .tolerance(entity.getTolerance())
                .datasheetUrl(entity.getDatasheetUrl())
                .certifications(entity.getCertifications())
                .diodeModel(entity.getDiodeModel())
                .thermalModel(entity.getThermalModel())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
