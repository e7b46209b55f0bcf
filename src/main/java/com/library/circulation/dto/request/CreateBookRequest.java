package com.library.circulation.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateBookRequest(

    @NotBlank(message = "Title must not be blank")
    @Size(max = 500, message = "Title must not exceed 500 characters")
    String title,

    @NotBlank(message = "Author must not be blank")
    @Size(max = 255, message = "Author must not exceed 255 characters")
    String author,

    @Size(max = 100, message = "Category must not exceed 100 characters")
    String category,

    @Size(max = 30, message = "ISBN must not exceed 30 characters")
    String isbn,

    @NotNull(message = "Total copies is required")
    @Min(value = 1, message = "Total copies must be at least 1")
    @Max(value = 500, message = "Total copies must not exceed 500")
    Integer totalCopies,

    @Min(value = 1, message = "Due period value must be at least 1")
    Integer duePeriodValue,

    @Pattern(regexp = "(?i)hours|days|weeks|months|years",
             message = "Due period unit must be one of hours, days, weeks, months, years")
    String duePeriodUnit
) {}
