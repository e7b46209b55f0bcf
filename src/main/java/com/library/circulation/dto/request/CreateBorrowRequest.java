package com.library.circulation.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * {@code duePeriodUnit} is free text on purpose: an unrecognised unit falls back to a
 * 24 hour loan instead of failing validation.
 */
public record CreateBorrowRequest(

    @NotNull(message = "Student ID is required")
    Long studentId,

    @NotNull(message = "Book ID is required")
    Long bookId,

    Long bookCopyId,

    @Min(value = 1, message = "Due period value must be at least 1")
    Integer duePeriodValue,

    @Size(max = 20, message = "Due period unit must not exceed 20 characters")
    String duePeriodUnit
) {}
