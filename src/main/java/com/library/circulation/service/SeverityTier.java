package com.library.circulation.service;

import java.time.Duration;
import java.util.Locale;

/**
 * Blacklist severity derived from a student's overdue loans. Thresholds are checked from
 * the top down; the first match wins.
 */
public enum SeverityTier {

    HIGH(3, 14, Duration.ofDays(21)),
    MEDIUM(2, 7, Duration.ofDays(14)),
    LOW(1, 0, Duration.ofDays(7));

    private final long minOverdueCount;
    private final long minDaysOverdue;
    private final Duration blacklistDuration;

    SeverityTier(long minOverdueCount, long minDaysOverdue, Duration blacklistDuration) {
        this.minOverdueCount = minOverdueCount;
        this.minDaysOverdue = minDaysOverdue;
        this.blacklistDuration = blacklistDuration;
    }

    public static SeverityTier classify(long overdueCount, long maxDaysOverdue) {
        if (overdueCount >= HIGH.minOverdueCount || maxDaysOverdue >= HIGH.minDaysOverdue) {
            return HIGH;
        }
        if (overdueCount >= MEDIUM.minOverdueCount || maxDaysOverdue >= MEDIUM.minDaysOverdue) {
            return MEDIUM;
        }
        return LOW;
    }

    public Duration blacklistDuration() {
        return blacklistDuration;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
