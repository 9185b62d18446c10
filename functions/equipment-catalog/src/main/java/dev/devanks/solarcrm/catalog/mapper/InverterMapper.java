package dev.devanks.solarcrm.catalog.mapper;

import dev.devanks.solarcrm.catalog.entity.InverterEntity;
import dev.devanks.solarcrm.catalog.model.Inverter;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class InverterMapper implements EntityMapper<Inverter, InverterEntity> {

    @Override
    public Inverter toDomain(InverterEntity document) {
        return Inverter.builder()
                .id(document.getId())
                .manufacturerId(document.getManufacturerId())
                .scope(document.getScope())
                .model(document.getModel())
                .ratedAcPowerW(document.getRatedAcPowerW() == null ? 0.0 : document.getRatedAcPowerW())
                .gridType(document.getGridType())
                .maxPvPowerW(document.getMaxPvPowerW())
                .maxDcVoltageV(document.getMaxDcVoltageV())
                .mpptCount(document.getMpptCount())
                .stringsPerMppt(document.getStringsPerMppt())
                .mpptVoltageRange(document.getMpptVoltageRange())
                .maxInputCurrentA(document.getMaxInputCurrentA())
                .maxApparentPowerVa(document.getMaxApparentPowerVa())
                .maxOutputCurrentA(document.getMaxOutputCurrentA())
                .nominalOutputVoltage(document.getNominalOutputVoltage())
                .nominalFrequencyHz(document.getNominalFrequencyHz())
                .maxEfficiencyPercent(document.getMaxEfficiencyPercent())
                .europeanEfficiencyPercent(document.getEuropeanEfficiencyPercent())
                .mpptEfficiencyPercent(document.getMpptEfficiencyPercent())
                .protections(copy(document.getProtections()))
                .certifications(copy(document.getCertifications()))
                .ipRating(document.getIpRating())
                .weightKg(document.getWeightKg())
                .warrantyYears(document.getWarrantyYears())
                .datasheetUrl(document.getDatasheetUrl())
                .referencePrice(document.getReferencePrice())
                .sandiaModel(document.getSandiaModel())
                .createdAt(document.getCreatedAt())
                .updatedAt(document.getUpdatedAt())
                .build();
    }

    @Override
    public InverterEntity toPersistence(Inverter entity) {
        return InverterEntity.builder()
                .id(entity.getId())
                .manufacturerId(entity.getManufacturerId())
                .scope(entity.getScope())
                .model(entity.getModel())
                .ratedAcPowerW(entity.getRatedAcPowerW())
                .gridType(entity.getGridType())
                .maxPvPowerW(entity.getMaxPvPowerW())
                .maxDcVoltageV(entity.getMaxDcVoltageV())
                .mpptCount(entity.getMpptCount())
                .stringsPerMppt(entity.getStringsPerMppt())
                .mpptVoltageRange(entity.getMpptVoltageRange())
                .maxInputCurrentA(entity.getMaxInputCurrentA())
                .maxApparentPowerVa(entity.getMaxApparentPowerVa())
                .maxOutputCurrentA(entity.getMaxOutputCurrentA())
                .nominalOutputVoltage(entity.getNominalOutputVoltage())
                .nominalFrequencyHz(entity.getNominalFrequencyHz())
                .maxEfficiencyPercent(entity.getMaxEfficiencyPercent())
                .europeanEfficiencyPercent(entity.getEuropeanEfficiencyPercent())
                .mpptEfficiencyPercent(entity.getMpptEfficiencyPercent())
                .protections(entity.getProtections())
                .certifications(entity.getCertifications())
                .ipRating(entity.getIpRating())
                .weightKg(entity.getWeightKg())
                .warrantyYears(entity.getWarrantyYears())
                .datasheetUrl(entity.getDatasheetUrl())
                .referencePrice(entity.getReferencePrice())
                .sandiaModel(entity.getSandiaModel())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
