package com.al.clinicalnormalizer.service.pipeline;

import com.al.clinicalnormalizer.config.NormalizerProperties;
import com.al.clinicalnormalizer.dto.ExtractionIssue;
import com.al.clinicalnormalizer.exception.DocumentParseException;
import com.al.clinicalnormalizer.model.NormalizedSection;
import com.al.clinicalnormalizer.model.PipelineResult;
import com.al.clinicalnormalizer.model.enums.SourceType;
import com.al.clinicalnormalizer.service.extractor.ExtractionContext;
import com.al.clinicalnormalizer.service.extractor.ExtractorRegistry;
import com.al.clinicalnormalizer.service.extractor.SectionExtractor;
import com.al.clinicalnormalizer.service.extractor.cda.CdaDocument;
import com.al.clinicalnormalizer.service.extractor.cda.CdaDocumentParser;
import com.al.clinicalnormalizer.service.extractor.fhir.FhirDocumentParser;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.hl7.fhir.r4.model.Bundle;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs the section extractors of one source format over a document.
 *
 * <p>
 * The document is parsed once and shared read-only. Every extractor runs as its own task
 * on the extraction pool; a failing extractor costs only its own section and is reported
 * as an {@link ExtractionIssue}. No method of this class throws to the caller.
 */
@Slf4j
@Service
public class ClinicalPipelineManager {

    private static final String DURATION_METRIC = "clinical.pipeline.duration";
    private static final String SECTIONS_METRIC = "clinical.pipeline.sections";

    private final ExtractorRegistry extractorRegistry;
    private final CdaDocumentParser cdaParser;
    private final FhirDocumentParser fhirParser;
    private final ExecutorService extractionExecutor;
    private final NormalizerProperties properties;
    private final MeterRegistry meterRegistry;

    public ClinicalPipelineManager(ExtractorRegistry extractorRegistry, CdaDocumentParser cdaParser,
            FhirDocumentParser fhirParser, @Qualifier("extractionExecutor") ExecutorService extractionExecutor,
            NormalizerProperties properties, MeterRegistry meterRegistry) {
        this.extractorRegistry = extractorRegistry;
        this.cdaParser = cdaParser;
        this.fhirParser = fhirParser;
        this.extractionExecutor = extractionExecutor;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public PipelineResult process(String rawDocument, SourceType sourceType) {
        return process(rawDocument, sourceType, null, null);
    }

    public PipelineResult process(String rawDocument, SourceType sourceType, Set<String> sectionsToExtract) {
        return process(rawDocument, sourceType, sectionsToExtract, null);
    }

    /**
     * @param sectionsToExtract section ids to run, or null for all registered extractors
     * @param locale            target language (and optional country); the configured
     *                          defaults when null
     */
    public PipelineResult process(String rawDocument, SourceType sourceType, Set<String> sectionsToExtract,
            Locale locale) {
        if (sourceType == null) {
            log.warn("Pipeline called without a source type");
            return PipelineResult.empty(null, List.of(ExtractionIssue.invalidRequest("Source type is required")));
        }
        if (rawDocument == null) {
            log.warn("Pipeline called without a {} document", sourceType);
            return PipelineResult.empty(sourceType, List.of(ExtractionIssue.invalidRequest("Document is required")));
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            if (sourceType == SourceType.CDA) {
                CdaDocument document = cdaParser.parse(rawDocument);
                return run(document, document.getDocumentId(), sourceType,
                        extractorRegistry.getCdaExtractors(), sectionsToExtract, locale);
            }
            Bundle bundle = fhirParser.parse(rawDocument);
            return run(bundle, bundleId(bundle), sourceType, extractorRegistry.getFhirExtractors(),
                    sectionsToExtract, locale);
        } catch (DocumentParseException e) {
            outcome = "parse_error";
            log.warn("Could not parse {} document: {}", sourceType, e.getMessage());
            return PipelineResult.empty(sourceType, List.of(ExtractionIssue.documentError(e.getMessage(), e)));
        } catch (RuntimeException e) {
            outcome = "error";
            log.error("Unexpected failure processing {} document", sourceType, e);
            return PipelineResult.empty(sourceType,
                    List.of(ExtractionIssue.documentError("Unexpected failure: " + e.getMessage(), e)));
        } finally {
            sample.stop(meterRegistry.timer(DURATION_METRIC, "source", sourceType.name(), "outcome", outcome));
        }
    }

    /**
     * Process an already parsed FHIR Bundle.
     */
    public PipelineResult process(Bundle bundle) {
        return process(bundle, null, null);
    }

    public PipelineResult process(Bundle bundle, Set<String> sectionsToExtract, Locale locale) {
        if (bundle == null) {
            return PipelineResult.empty(SourceType.FHIR,
                    List.of(ExtractionIssue.invalidRequest("Bundle is required")));
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return run(bundle, bundleId(bundle), SourceType.FHIR, extractorRegistry.getFhirExtractors(),
                    sectionsToExtract, locale);
        } finally {
            sample.stop(meterRegistry.timer(DURATION_METRIC, "source", SourceType.FHIR.name(), "outcome", "success"));
        }
    }

    private <D> PipelineResult run(D document, String documentId, SourceType sourceType,
            Map<String, ? extends SectionExtractor<D>> extractors, Set<String> sectionsToExtract, Locale locale) {
        String previousDocumentId = MDC.get(MdcTaskDecorator.MDC_KEY);
        String correlationId = documentId != null ? documentId : UUID.randomUUID().toString();
        MDC.put(MdcTaskDecorator.MDC_KEY, correlationId);
        try {
            ExtractionContext context = context(correlationId, locale);
            List<ExtractionIssue> issues = new ArrayList<>();
            Map<String, SectionExtractor<D>> selected = select(extractors, sectionsToExtract, issues);
            log.info("Processing {} document with {} extractors: {}", sourceType, selected.size(), selected.keySet());

            Map<String, Future<NormalizedSection>> tasks = new LinkedHashMap<>();
            for (Map.Entry<String, SectionExtractor<D>> entry : selected.entrySet()) {
                SectionExtractor<D> extractor = entry.getValue();
                try {
                    tasks.put(entry.getKey(), extractionExecutor.submit(
                            MdcTaskDecorator.wrap(() -> extractor.extract(document, context))));
                } catch (RejectedExecutionException e) {
                    log.warn("Extraction pool rejected section '{}'", entry.getKey());
                    issues.add(ExtractionIssue.extractorFailure(entry.getKey(), e));
                }
            }

            List<NormalizedSection> sections = new ArrayList<>();
            for (Map.Entry<String, Future<NormalizedSection>> task : tasks.entrySet()) {
                String sectionId = task.getKey();
                try {
                    NormalizedSection section = task.getValue().get();
                    if (section == null) {
                        throw new IllegalStateException("Extractor returned no section");
                    }
                    sections.add(section);
                    countSection(sourceType, "success");
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Extractor for section '{}' failed: {}", sectionId, cause.toString(), cause);
                    issues.add(ExtractionIssue.extractorFailure(sectionId, cause));
                    countSection(sourceType, "failed");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for section '{}'", sectionId);
                    issues.add(ExtractionIssue.extractorFailure(sectionId, e));
                    tasks.values().forEach(future -> future.cancel(true));
                    break;
                } catch (RuntimeException e) {
                    // Null section or cancelled task
                    log.warn("Extractor for section '{}' failed: {}", sectionId, e.toString());
                    issues.add(ExtractionIssue.extractorFailure(sectionId, e));
                    countSection(sourceType, "failed");
                }
            }

            PipelineResult result = new PipelineResult(sourceType, sections, issues);
            log.info("Finished {} document: {} sections, {} with data, {} entries, {} issues", sourceType,
                    result.getSectionsCount(), result.getSectionsWithData(), result.getTotalEntries(),
                    issues.size());
            return result;
        } finally {
            if (previousDocumentId != null) {
                MDC.put(MdcTaskDecorator.MDC_KEY, previousDocumentId);
            } else {
                MDC.remove(MdcTaskDecorator.MDC_KEY);
            }
        }
    }

    private <D> Map<String, SectionExtractor<D>> select(Map<String, ? extends SectionExtractor<D>> extractors,
            Set<String> sectionsToExtract, List<ExtractionIssue> issues) {
        Map<String, SectionExtractor<D>> selected = new LinkedHashMap<>();
        if (sectionsToExtract == null) {
            selected.putAll(extractors);
            return selected;
        }
        for (String sectionId : sectionsToExtract) {
            SectionExtractor<D> extractor = extractors.get(sectionId);
            if (extractor != null) {
                selected.put(sectionId, extractor);
            } else {
                log.warn("No extractor registered for requested section '{}'", sectionId);
                issues.add(ExtractionIssue.unknownSection(sectionId));
            }
        }
        return selected;
    }

    private ExtractionContext context(String documentId, Locale locale) {
        if (locale == null || locale.getLanguage().isEmpty()) {
            return ExtractionContext.from(properties, documentId);
        }
        return ExtractionContext.builder()
                .documentId(documentId)
                .language(locale.getLanguage())
                .country(locale.getCountry().isEmpty() ? null : locale.getCountry())
                .build();
    }

    private static String bundleId(Bundle bundle) {
        return bundle.hasIdElement() && bundle.getIdElement().hasIdPart() ? bundle.getIdElement().getIdPart() : null;
    }

    private void countSection(SourceType sourceType, String outcome) {
        meterRegistry.counter(SECTIONS_METRIC, "source", sourceType.name(), "outcome", outcome).increment();
    }
}
