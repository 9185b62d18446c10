package dev.devanks.solarcrm.catalog.mapper;

import dev.devanks.solarcrm.catalog.entity.ManufacturerEntity;
import dev.devanks.solarcrm.catalog.model.Manufacturer;
import dev.devanks.solarcrm.catalog.model.ManufacturerType;
import org.springframework.stereotype.Component;

@Component
public class ManufacturerMapper implements EntityMapper<Manufacturer, ManufacturerEntity> {

    @Override
    public Manufacturer toDomain(ManufacturerEntity document) {
        return Manufacturer.builder()
                .id(document.getId())
                .externalId(document.getExternalId())
                .name(document.getName())
                .type(document.getType() == null ? null : ManufacturerType.valueOf(document.getType()))
                .scope(document.getScope())
                .isDefault(Boolean.TRUE.equals(document.getIsDefault()))
                .country(document.getCountry())
                .website(document.getWebsite())
                .description(document.getDescription())
                .logoUrl(document.getLogoUrl())
                .foundedYear(document.getFoundedYear())
                .active(!Boolean.FALSE.equals(document.getActive()))
                .createdAt(document.getCreatedAt())
                .updatedAt(document.getUpdatedAt())
                .build();
    }

    @Override
    public ManufacturerEntity toPersistence(Manufacturer entity) {
        return ManufacturerEntity.builder()
                .id(entity.getId())
                .externalId(entity.getExternalId())
                .name(entity.getName())
                .type(entity.getType() == null ? null : entity.getType().name())
                .scope(entity.getScope())
                .isDefault(entity.isDefault())
                .country(entity.getCountry())
                .website(entity.getWebsite())
                .description(entity.getDescription())
                .logoUrl(entity.getLogoUrl())
                .foundedYear(entity.getFoundedYear())
                .active(entity.isActive())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
