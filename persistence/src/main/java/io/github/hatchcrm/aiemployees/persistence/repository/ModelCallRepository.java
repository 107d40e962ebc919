package io.github.hatchcrm.aiemployees.persistence.repository;

import io.github.hatchcrm.aiemployees.persistence.document.ModelCallDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ModelCallRepository extends MongoRepository<ModelCallDocument, String> {
    List<ModelCallDocument> findBySessionIdOrderByTimestampDesc(String sessionId);
}
