package com.library.circulation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Tunables for the borrowing lifecycle, bound from {@code library.circulation.*}.
 *
 * @param gracePeriod how long a loan may sit past its due instant before the sweep
 *                    promotes it to OVERDUE
 * @param zone        zone used for calendar-aware month and year arithmetic on due dates
 * @param sweep       overdue sweep scheduling
 * @param blacklist   blacklist policy switches
 */
@ConfigurationProperties(prefix = "library.circulation")
public record CirculationProperties(
    @DefaultValue("P1D") Duration gracePeriod,
    @DefaultValue("UTC") ZoneId zone,
    @DefaultValue Sweep sweep,
    @DefaultValue Blacklist blacklist
) {

    /**
     * @param enabled      run the sweep on a fixed delay
     * @param interval     delay between scheduled runs
     * @param beforeBorrow run the sweep opportunistically before each borrow
     */
    public record Sweep(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("PT15M") Duration interval,
        @DefaultValue("true") boolean beforeBorrow
    ) {}

    /**
     * @param enforceLowTier when false, a student whose overdue loans only reach the LOW
     *                       tier is left off the blacklist
     */
    public record Blacklist(
        @DefaultValue("false") boolean enforceLowTier
    ) {}
}
