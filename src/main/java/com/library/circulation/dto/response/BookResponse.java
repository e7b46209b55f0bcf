package com.library.circulation.dto.response;

import com.library.circulation.entity.CopyStatus;
import com.library.circulation.entity.DuePeriodUnit;

import java.time.Instant;
import java.util.List;

public record BookResponse(
    Long id,
    String title,
    String author,
    String category,
    Integer duePeriodValue,
    DuePeriodUnit duePeriodUnit,
    int totalCopies,
    long availableCopies,
    List<CopySummary> copies,
    Instant createdAt,
    Instant updatedAt
) {
    public record CopySummary(Long id, String catalogCode, CopyStatus status) {}
}
