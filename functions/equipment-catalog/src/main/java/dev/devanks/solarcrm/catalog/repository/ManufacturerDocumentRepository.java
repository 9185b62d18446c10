package dev.devanks.solarcrm.catalog.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.solarcrm.catalog.entity.ManufacturerEntity;
import org.springframework.stereotype.Repository;

@Repository
public interface ManufacturerDocumentRepository extends FirestoreReactiveRepository<ManufacturerEntity> {
}
