package com.library.circulation.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record UpdateStudentRequest(

    @Size(min = 1, max = 255, message = "Name must be between 1 and 255 characters")
    String name,

    @Size(min = 1, max = 50, message = "Admission number must be between 1 and 50 characters")
    String admissionNumber,

    @Email(message = "Email must be a valid address")
    @Size(max = 255, message = "Email must not exceed 255 characters")
    String email,

    @Size(max = 100, message = "Class must not exceed 100 characters")
    String className
) {}
