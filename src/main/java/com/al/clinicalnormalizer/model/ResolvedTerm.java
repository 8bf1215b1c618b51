package com.al.clinicalnormalizer.model;

import com.al.clinicalnormalizer.model.enums.FallbackReason;
import com.al.clinicalnormalizer.model.enums.Provenance;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of resolving one code to display text.
 *
 * <p>
 * {@code display} is never empty and never carries markup; every term records its
 * provenance for audit badges.
 */
@Value
public class ResolvedTerm {

    String code;
    String codeSystemOid;
    String codeSystemName;
    String display;
    Provenance provenance;
    FallbackReason fallbackReason;

    @JsonCreator
    @Builder(toBuilder = true)
    public ResolvedTerm(@JsonProperty("code") String code,
            @JsonProperty("codeSystemOid") String codeSystemOid,
            @JsonProperty("codeSystemName") String codeSystemName,
            @JsonProperty("display") String display,
            @JsonProperty("provenance") Provenance provenance,
            @JsonProperty("fallbackReason") FallbackReason fallbackReason) {
        if (display == null || display.isBlank()) {
            throw new IllegalArgumentException("Resolved term display must not be empty");
        }
        if (provenance == null) {
            throw new IllegalArgumentException("Resolved term must carry a provenance");
        }
        this.code = code;
        this.codeSystemOid = codeSystemOid;
        this.codeSystemName = codeSystemName;
        this.display = display;
        this.provenance = provenance;
        this.fallbackReason = fallbackReason;
    }

    @JsonIgnore
    public boolean isResolved() {
        return provenance != Provenance.FALLBACK;
    }

    @JsonIgnore
    public boolean isCoded() {
        return code != null && !code.isBlank() && codeSystemOid != null && !codeSystemOid.isBlank();
    }
}
