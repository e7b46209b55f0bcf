package com.library.circulation.entity;

import java.util.Locale;

/**
 * Time unit of a loan period. Stored by name ({@code EnumType.STRING}).
 *
 * <p>Incoming unit strings are matched case-insensitively by {@link #parse(String)}.
 * An unrecognised string yields {@code null}, which the due-date calculator treats as
 * "use the 24 hour default" rather than as an error.
 */
public enum DuePeriodUnit {
    HOURS,
    DAYS,
    WEEKS,
    MONTHS,
    YEARS;

    /**
     * @return the matching unit, or {@code null} when {@code value} is blank or unknown
     */
    public static DuePeriodUnit parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (DuePeriodUnit unit : values()) {
            if (unit.name().equals(normalized)) {
                return unit;
            }
        }
        return null;
    }
}
