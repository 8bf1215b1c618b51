package com.al.clinicalnormalizer.util;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;

/**
 * Utility class for normalizing clinical date/time values from CDA and FHIR sources to a
 * single ISO-8601 representation.
 *
 * <p>
 * CDA (HL7 v3 TS) format: YYYY[MM[DD[HH[mm[ss[.SSSS]]]]]][+/-ZZZZ]
 * Examples:
 * <ul>
 * <li>20260116 - date only, normalized to 2026-01-16</li>
 * <li>20260116120000-0500 - normalized to 2026-01-16T12:00:00-05:00</li>
 * <li>202601 - partial date, normalized to 2026-01</li>
 * </ul>
 *
 * <p>
 * FHIR date/dateTime values are already ISO-8601 but vary in precision and fraction
 * digits; they are re-rendered with the same formatters so that equivalent facts from both
 * formats compare equal.
 */
public final class DateTimeUtil {

    private DateTimeUtil() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    // HL7 v3 TS with seconds, optional fraction and optional offset
    private static final DateTimeFormatter HL7_DATETIME_WITH_TZ = new DateTimeFormatterBuilder()
            .appendValue(ChronoField.YEAR, 4)
            .appendValue(ChronoField.MONTH_OF_YEAR, 2)
            .appendValue(ChronoField.DAY_OF_MONTH, 2)
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .appendOffset("+HHMM", "Z")
            .toFormatter();

    private static final DateTimeFormatter HL7_DATETIME = new DateTimeFormatterBuilder()
            .appendValue(ChronoField.YEAR, 4)
            .appendValue(ChronoField.MONTH_OF_YEAR, 2)
            .appendValue(ChronoField.DAY_OF_MONTH, 2)
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .toFormatter();

    private static final DateTimeFormatter HL7_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private static final DateTimeFormatter ISO_DATETIME_OFFSET = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX");
    private static final DateTimeFormatter ISO_DATETIME_LOCAL = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    /**
     * Normalize a CDA TS value to ISO-8601.
     *
     * @param cdaTimestamp value of a CDA {@code value} attribute (e.g. "20260116120000+0100")
     * @return ISO-8601 text, or null when the input is blank
     * @throws DateTimeException if the value is not a valid TS
     */
    public static String normalizeCdaTimestamp(String cdaTimestamp) {
        if (cdaTimestamp == null || cdaTimestamp.isBlank()) {
            return null;
        }
        String ts = cdaTimestamp.trim();

        try {
            int offsetStart = Math.max(ts.indexOf('+'), ts.indexOf('-'));
            String datePart = offsetStart > 0 ? ts.substring(0, offsetStart) : ts;
            int digits = datePart.indexOf('.') > 0 ? datePart.indexOf('.') : datePart.length();

            switch (digits) {
                case 4:
                    return Year.parse(datePart).toString();
                case 6:
                    return YearMonth.of(Integer.parseInt(datePart.substring(0, 4)),
                            Integer.parseInt(datePart.substring(4, 6))).toString();
                case 8:
                    return LocalDate.parse(datePart, HL7_DATE).toString();
                default:
                    break;
            }

            // Pad HH or HHmm to HHmmss
            String padded = padToSeconds(datePart, digits);
            if (offsetStart > 0) {
                OffsetDateTime odt = OffsetDateTime.parse(padded + ts.substring(offsetStart), HL7_DATETIME_WITH_TZ);
                return odt.truncatedTo(ChronoUnit.SECONDS).format(ISO_DATETIME_OFFSET);
            }
            LocalDateTime ldt = LocalDateTime.parse(padded, HL7_DATETIME);
            return ldt.truncatedTo(ChronoUnit.SECONDS).format(ISO_DATETIME_LOCAL);
        } catch (DateTimeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DateTimeException("Failed to parse CDA timestamp: " + cdaTimestamp, e);
        }
    }

    /**
     * Normalize a FHIR date or dateTime string to the same representation produced by
     * {@link #normalizeCdaTimestamp(String)}.
     *
     * @throws DateTimeException if the value is not a valid FHIR date/dateTime
     */
    public static String normalizeFhirDateTime(String fhirDateTime) {
        if (fhirDateTime == null || fhirDateTime.isBlank()) {
            return null;
        }
        String value = fhirDateTime.trim();

        switch (value.length()) {
            case 4:
                return Year.parse(value).toString();
            case 7:
                return YearMonth.parse(value).toString();
            case 10:
                return LocalDate.parse(value).toString();
            default:
                break;
        }

        if (value.endsWith("Z") || value.lastIndexOf('+') > 10 || value.lastIndexOf('-') > 10) {
            return OffsetDateTime.parse(value).truncatedTo(ChronoUnit.SECONDS).format(ISO_DATETIME_OFFSET);
        }
        return LocalDateTime.parse(value).truncatedTo(ChronoUnit.SECONDS).format(ISO_DATETIME_LOCAL);
    }

    /**
     * Lenient variant used by extractors: a malformed date is reported as null rather than
     * failing the entry.
     */
    public static String normalizeCdaTimestampOrNull(String cdaTimestamp) {
        try {
            return normalizeCdaTimestamp(cdaTimestamp);
        } catch (DateTimeException e) {
            return null;
        }
    }

    public static String normalizeFhirDateTimeOrNull(String fhirDateTime) {
        try {
            return normalizeFhirDateTime(fhirDateTime);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static String padToSeconds(String datePart, int digits) {
        if (digits >= 14) {
            return datePart;
        }
        StringBuilder sb = new StringBuilder(datePart.substring(0, digits));
        for (int i = digits; i < 14; i++) {
            sb.append('0');
        }
        return sb.toString();
    }
}
