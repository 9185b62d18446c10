package dev.devanks.solarcrm.catalog.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.solarcrm.catalog.entity.InverterEntity;
import org.springframework.stereotype.Repository;

@Repository
public interface InverterDocumentRepository extends FirestoreReactiveRepository<InverterEntity> {
}
