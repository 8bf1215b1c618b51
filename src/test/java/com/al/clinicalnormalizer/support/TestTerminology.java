package com.al.clinicalnormalizer.support;

import com.al.clinicalnormalizer.config.NormalizerProperties;
import com.al.clinicalnormalizer.service.extractor.ExtractorRegistry;
import com.al.clinicalnormalizer.service.extractor.cda.CdaAdvanceDirectiveExtractor;
import com.al.clinicalnormalizer.service.extractor.cda.CdaAllergyExtractor;
import com.al.clinicalnormalizer.service.extractor.cda.CdaConditionExtractor;
import com.al.clinicalnormalizer.service.extractor.cda.CdaFunctionalStatusExtractor;
import com.al.clinicalnormalizer.service.extractor.cda.CdaImmunizationExtractor;
import com.al.clinicalnormalizer.service.extractor.cda.CdaMedicalDeviceExtractor;
import com.al.clinicalnormalizer.service.extractor.cda.CdaMedicationExtractor;
import com.al.clinicalnormalizer.service.extractor.cda.CdaObservationExtractor;
import com.al.clinicalnormalizer.service.extractor.cda.CdaPregnancyHistoryExtractor;
import com.al.clinicalnormalizer.service.extractor.cda.CdaProcedureExtractor;
import com.al.clinicalnormalizer.service.extractor.cda.CdaSocialHistoryExtractor;
import com.al.clinicalnormalizer.service.extractor.fhir.FhirAdvanceDirectiveExtractor;
import com.al.clinicalnormalizer.service.extractor.fhir.FhirAllergyExtractor;
import com.al.clinicalnormalizer.service.extractor.fhir.FhirConditionExtractor;
import com.al.clinicalnormalizer.service.extractor.fhir.FhirFunctionalStatusExtractor;
import com.al.clinicalnormalizer.service.extractor.fhir.FhirImmunizationExtractor;
import com.al.clinicalnormalizer.service.extractor.fhir.FhirMedicalDeviceExtractor;
import com.al.clinicalnormalizer.service.extractor.fhir.FhirMedicationExtractor;
import com.al.clinicalnormalizer.service.extractor.fhir.FhirObservationExtractor;
import com.al.clinicalnormalizer.service.extractor.fhir.FhirPregnancyHistoryExtractor;
import com.al.clinicalnormalizer.service.extractor.fhir.FhirProcedureExtractor;
import com.al.clinicalnormalizer.service.extractor.fhir.FhirSocialHistoryExtractor;
import com.al.clinicalnormalizer.service.terminology.CacheTtlPolicy;
import com.al.clinicalnormalizer.service.terminology.CodeSystemRegistry;
import com.al.clinicalnormalizer.service.terminology.ConceptStore;
import com.al.clinicalnormalizer.service.terminology.LocalTerminologyCache;
import com.al.clinicalnormalizer.service.terminology.TerminologyResolver;
import com.google.common.base.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Wiring shortcuts for tests that need a real resolver without a Spring context.
 */
public final class TestTerminology {

    private TestTerminology() {
    }

    public static TerminologyResolver resolver(ConceptStore store) {
        return resolver(store, new SimpleMeterRegistry(), Ticker.systemTicker());
    }

    public static TerminologyResolver resolver(ConceptStore store, MeterRegistry meterRegistry, Ticker ticker) {
        NormalizerProperties properties = new NormalizerProperties();
        CacheTtlPolicy ttlPolicy = new CacheTtlPolicy(properties.getCacheTtlPositive(),
                properties.getCacheTtlNegative());
        return new TerminologyResolver(new CodeSystemRegistry(), store,
                new LocalTerminologyCache(ttlPolicy, properties.getCacheMaximumSize(), ticker), meterRegistry,
                properties);
    }

    /**
     * Every CDA and FHIR extractor, as Spring would discover them.
     */
    public static ExtractorRegistry registry(TerminologyResolver resolver) {
        CodeSystemRegistry codeSystems = new CodeSystemRegistry();
        return new ExtractorRegistry(
                List.of(new CdaAdvanceDirectiveExtractor(resolver), new CdaAllergyExtractor(resolver),
                        new CdaConditionExtractor(resolver), new CdaFunctionalStatusExtractor(resolver),
                        new CdaImmunizationExtractor(resolver), new CdaMedicalDeviceExtractor(resolver),
                        new CdaMedicationExtractor(resolver), new CdaObservationExtractor(resolver),
                        new CdaPregnancyHistoryExtractor(resolver), new CdaProcedureExtractor(resolver),
                        new CdaSocialHistoryExtractor(resolver)),
                List.of(new FhirAdvanceDirectiveExtractor(resolver, codeSystems),
                        new FhirAllergyExtractor(resolver, codeSystems),
                        new FhirConditionExtractor(resolver, codeSystems),
                        new FhirFunctionalStatusExtractor(resolver, codeSystems),
                        new FhirImmunizationExtractor(resolver, codeSystems),
                        new FhirMedicalDeviceExtractor(resolver, codeSystems),
                        new FhirMedicationExtractor(resolver, codeSystems),
                        new FhirObservationExtractor(resolver, codeSystems),
                        new FhirPregnancyHistoryExtractor(resolver, codeSystems),
                        new FhirProcedureExtractor(resolver, codeSystems),
                        new FhirSocialHistoryExtractor(resolver, codeSystems)));
    }

    public static String fixture(String path) {
        try (InputStream in = TestTerminology.class.getClassLoader().getResourceAsStream("fixtures/" + path)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
