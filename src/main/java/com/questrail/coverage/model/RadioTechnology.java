package com.questrail.coverage.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Cellular radio access technologies the radio lookup can report, with the
 * display code and numeric id submitted with each fence.
 */
public enum RadioTechnology {
    GPRS("2G/GSM", 1),
    EDGE("2G/EDGE", 2),
    WCDMA("3G/UMTS", 3),
    CDMA_1X("2G/CDMA", 4),
    CDMA_EVDO_REV0("2G/EVDO_0", 5),
    CDMA_EVDO_REVA("2G/EVDO_A", 6),
    HSDPA("3G/HSDPA", 8),
    HSUPA("3G/HSUPA", 9),
    CDMA_EVDO_REVB("2G/EVDO_B", 12),
    LTE("4G/LTE", 13),
    EHRPD("2G/HRPD", 14),
    NR("5G/NR", 20),
    NR_NSA("5G/NRNSA", 41);

    private final String code;
    private final int id;

    RadioTechnology(String code, int id) {
        this.code = code;
        this.id = id;
    }

    /** Submitted {@code technology} value, e.g. {@code 4G/LTE}. */
    public String code() {
        return code;
    }

    /** Submitted {@code technology_id} value. */
    public int id() {
        return id;
    }

    /**
     * Resolves either the enum name or the display code, ignoring case.
     */
    public static Optional<RadioTechnology> fromCode(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(trimmed) || t.code.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
