package com.library.circulation.repository;

import java.time.Instant;

/**
 * Per-student aggregate of OVERDUE borrow records.
 *
 * @param earliestDueDate the oldest due instant, which yields the maximum days overdue
 */
public record OverdueSummary(Long studentId, Long overdueCount, Instant earliestDueDate) {}
