package com.al.clinicalnormalizer.model;

import com.al.clinicalnormalizer.exception.MalformedSourceElementException;
import lombok.Value;

/**
 * A code exactly as it was found in a source document.
 */
@Value
public class ClinicalCode {

    String code;
    String codeSystemOid;
    String sourceDisplay;

    private ClinicalCode(String code, String codeSystemOid, String sourceDisplay) {
        this.code = code;
        this.codeSystemOid = codeSystemOid;
        this.sourceDisplay = sourceDisplay;
    }

    /**
     * Create a code, rejecting elements that lack the code value or its system.
     *
     * @throws MalformedSourceElementException if code or system is blank
     */
    public static ClinicalCode of(String code, String codeSystemOid, String sourceDisplay) {
        if (code == null || code.isBlank()) {
            throw new MalformedSourceElementException("code", "Coded element has no code value");
        }
        if (codeSystemOid == null || codeSystemOid.isBlank()) {
            throw new MalformedSourceElementException("codeSystem",
                    "Coded element '" + code + "' has no code system");
        }
        return new ClinicalCode(code.trim(), codeSystemOid.trim(), sourceDisplay);
    }

    public boolean hasSourceDisplay() {
        return sourceDisplay != null && !sourceDisplay.isBlank();
    }
}
