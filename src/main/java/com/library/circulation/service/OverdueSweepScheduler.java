package com.library.circulation.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the overdue sweep on a fixed delay. Disable with
 * {@code library.circulation.sweep.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "library.circulation.sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class OverdueSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(OverdueSweepScheduler.class);

    private final OverdueSweepService overdueSweepService;

    @Scheduled(fixedDelayString = "${library.circulation.sweep.interval:PT15M}",
               initialDelayString = "${library.circulation.sweep.interval:PT15M}")
    public void runSweep() {
        try {
            overdueSweepService.sweep();
        } catch (RuntimeException e) {
            // The next run retries; the sweep is idempotent.
            log.error("Scheduled overdue sweep failed", e);
        }
    }
}
