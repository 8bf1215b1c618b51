package com.al.clinicalnormalizer.model.catalogue;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

@Data
@Document(collection = "terminology_concepts")
@CompoundIndexes({
        @CompoundIndex(def = "{'code': 1, 'codeSystemOid': 1}", name = "code_system_idx"),
        @CompoundIndex(def = "{'code': 1, 'valueSetOid': 1}", name = "code_value_set_idx")
})
public class ConceptDocument {
    @Id
    private String id;

    private String code;
    private String codeSystemOid;
    private String codeSystemVersion;

    // Defining OID of the value set the concept was imported from
    private String valueSetOid;

    private String status; // "active", "inactive"
    private String display;
}
