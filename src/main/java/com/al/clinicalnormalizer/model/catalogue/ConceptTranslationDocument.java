package com.al.clinicalnormalizer.model.catalogue;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

@Data
@Document(collection = "terminology_translations")
@CompoundIndex(def = "{'conceptId': 1, 'languageCode': 1, 'countryCode': 1}", name = "concept_language_idx")
public class ConceptTranslationDocument {
    @Id
    private String id;

    private String conceptId;
    private String languageCode;
    private String countryCode; // null for language-wide translations
    private String translatedDisplay;
}
