package com.al.clinicalnormalizer.service.extractor.fhir;

import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.ClinicalSectionType;
import com.al.clinicalnormalizer.service.extractor.ExtractionContext;
import com.al.clinicalnormalizer.service.terminology.CodeSystemRegistry;
import com.al.clinicalnormalizer.service.terminology.TerminologyResolver;
import com.al.clinicalnormalizer.util.ClinicalVocabulary;
import com.al.clinicalnormalizer.util.DisplaySanitizer;
import com.al.clinicalnormalizer.util.MappingConstants;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Device;
import org.hl7.fhir.r4.model.DeviceUseStatement;
import org.hl7.fhir.r4.model.Identifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Device use statements. The device itself is followed through the statement's reference
 * to a contained or bundled Device, whose type is the coded concept.
 */
@Component
public class FhirMedicalDeviceExtractor extends AbstractFhirSectionExtractor<DeviceUseStatement> {

    public FhirMedicalDeviceExtractor(TerminologyResolver resolver, CodeSystemRegistry codeSystemRegistry) {
        super(resolver, codeSystemRegistry, DeviceUseStatement.class);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.MEDICAL_DEVICES;
    }

    @Override
    protected ClinicalSectionEntry toEntry(DeviceUseStatement statement, int index, Bundle bundle,
            ExtractionContext context) {
        Optional<Device> device = referencedResource(statement, statement.getDevice(), bundle, Device.class);
        CodeableConcept type = device.map(Device::getType).orElse(null);
        List<ResolvedTerm> concepts = resolveAll(type, context);

        String name = device.map(FhirMedicalDeviceExtractor::deviceName).orElse(null);
        String displayText = concepts.isEmpty() && FhirCodings.text(type) == null && name != null
                ? name
                : displayText(concepts, type, "device");

        String start = null;
        String end = null;
        if (statement.hasTimingPeriod()) {
            start = FhirCodings.date(statement.getTimingPeriod().getStartElement());
            end = FhirCodings.date(statement.getTimingPeriod().getEndElement());
        } else if (statement.hasTimingDateTimeType()) {
            start = FhirCodings.date(statement.getTimingDateTimeType());
        }

        String status;
        if (statement.hasStatus()) {
            status = ClinicalVocabulary.eventStatusOrCode(statement.getStatus().toCode());
        } else {
            status = end != null ? ClinicalVocabulary.COMPLETED : ClinicalVocabulary.ACTIVE;
        }

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(statement, index))
                .displayText(displayText)
                .codedConcepts(concepts)
                .clinicalStatus(status)
                .onsetDate(start)
                .recordedDate(FhirCodings.date(statement.getRecordedOnElement()));

        putDetail(builder, MappingConstants.DETAIL_DEVICE_ID,
                device.map(FhirMedicalDeviceExtractor::deviceId).orElse(null));
        putDetail(builder, MappingConstants.DETAIL_END_DATE, end);
        if (statement.hasBodySite()) {
            putDetail(builder, MappingConstants.DETAIL_BODY_SITE, displayOf(statement.getBodySite(), context));
        }
        addNotes(builder, statement.getNote());
        return builder.build();
    }

    private static String deviceName(Device device) {
        for (Device.DeviceDeviceNameComponent deviceName : device.getDeviceName()) {
            if (deviceName.hasName()) {
                return DisplaySanitizer.sanitize(deviceName.getName());
            }
        }
        return null;
    }

    private static String deviceId(Device device) {
        for (Identifier identifier : device.getIdentifier()) {
            if (identifier.hasValue()) {
                return identifier.getValue();
            }
        }
        for (Device.DeviceUdiCarrierComponent udi : device.getUdiCarrier()) {
            if (udi.hasDeviceIdentifier()) {
                return udi.getDeviceIdentifier();
            }
        }
        return null;
    }
}
