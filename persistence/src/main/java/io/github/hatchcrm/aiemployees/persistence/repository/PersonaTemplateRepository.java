package io.github.hatchcrm.aiemployees.persistence.repository;

import io.github.hatchcrm.aiemployees.persistence.document.PersonaTemplateDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PersonaTemplateRepository extends MongoRepository<PersonaTemplateDocument, String> {
    List<PersonaTemplateDocument> findByActiveTrue();
}
