package dev.devanks.solarcrm.catalog.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.solarcrm.catalog.entity.SolarModuleEntity;
import org.springframework.stereotype.Repository;

@Repository
public interface SolarModuleDocumentRepository extends FirestoreReactiveRepository<SolarModuleEntity> {
}
