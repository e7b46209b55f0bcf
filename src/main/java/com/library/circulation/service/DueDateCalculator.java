package com.library.circulation.service;

import com.library.circulation.config.CirculationProperties;
import com.library.circulation.entity.DuePeriodUnit;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Maps a start instant and a loan period to a due instant.
 *
 * <p>Hours are exact durations. Days, weeks, months and years are calendar arithmetic in
 * the configured zone, so a month added to 31 January lands on the last day of February
 * rather than rolling into March. A week is always seven days.
 *
 * <p>A {@code null} unit means "unknown or missing" and falls back to 24 hours, ignoring
 * {@code value}. This mirrors how loans were issued historically; it is not treated as an
 * error.
 *
 * <p>Due instants after {@link #LATEST_DUE_DATE} are rejected with
 * {@link IllegalArgumentException}, as are periods too large for {@code java.time} to add.
 */
@Component
public class DueDateCalculator {

    static final int FALLBACK_HOURS = 24;

    public static final Instant LATEST_DUE_DATE = Instant.parse("9999-12-31T23:59:59Z");

    private final ZoneId zone;

    @Autowired
    public DueDateCalculator(CirculationProperties properties) {
        this(properties.zone());
    }

    public DueDateCalculator(ZoneId zone) {
        this.zone = zone;
    }

    public Instant computeDueDate(Instant start, int value, DuePeriodUnit unit) {
        if (unit == null) {
            return start.plusSeconds(FALLBACK_HOURS * 3600L);
        }
        if (value < 1) {
            throw new IllegalArgumentException("Due period value must be at least 1, got " + value);
        }

        Instant due;
        try {
            ZonedDateTime from = start.atZone(zone);
            ZonedDateTime dueAt = switch (unit) {
                case HOURS -> from.plusHours(value);
                case DAYS -> from.plusDays(value);
                case WEEKS -> from.plusDays(value * 7L);
                case MONTHS -> from.plusMonths(value);
                case YEARS -> from.plusYears(value);
            };
            due = dueAt.toInstant();
        } catch (DateTimeException | ArithmeticException e) {
            throw new IllegalArgumentException(
                "Due period of " + value + " " + unit + " is out of range", e);
        }
        if (due.isAfter(LATEST_DUE_DATE)) {
            throw new IllegalArgumentException(
                "Due period of " + value + " " + unit + " ends after " + LATEST_DUE_DATE);
        }
        return due;
    }
}
