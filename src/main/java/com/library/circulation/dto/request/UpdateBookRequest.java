package com.library.circulation.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdateBookRequest(

    @Size(min = 1, max = 500, message = "Title must be between 1 and 500 characters")
    String title,

    @Size(min = 1, max = 255, message = "Author must be between 1 and 255 characters")
    String author,

    @Size(max = 100, message = "Category must not exceed 100 characters")
    String category,

    @Min(value = 1, message = "Due period value must be at least 1")
    Integer duePeriodValue,

    @Pattern(regexp = "(?i)hours|days|weeks|months|years",
             message = "Due period unit must be one of hours, days, weeks, months, years")
    String duePeriodUnit
) {}
