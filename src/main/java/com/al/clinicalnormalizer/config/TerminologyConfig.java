package com.al.clinicalnormalizer.config;

import com.al.clinicalnormalizer.repository.ConceptRepository;
import com.al.clinicalnormalizer.repository.ConceptTranslationRepository;
import com.al.clinicalnormalizer.service.terminology.ConceptStore;
import com.al.clinicalnormalizer.service.terminology.MongoConceptStore;
import com.al.clinicalnormalizer.service.terminology.TimeBoundedConceptStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;

/**
 * Wires the concept catalogue: MongoDB repositories behind a lookup timeout.
 */
@Configuration
public class TerminologyConfig {

    @Bean
    public ConceptStore conceptStore(ConceptRepository conceptRepository,
            ConceptTranslationRepository translationRepository,
            @Qualifier("lookupExecutor") ExecutorService lookupExecutor,
            NormalizerProperties properties) {
        return new TimeBoundedConceptStore(new MongoConceptStore(conceptRepository, translationRepository),
                lookupExecutor, properties.getLookupTimeout());
    }
}
