package com.library.circulation.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateStudentRequest(

    @NotBlank(message = "Name must not be blank")
    @Size(max = 255, message = "Name must not exceed 255 characters")
    String name,

    @NotBlank(message = "Admission number must not be blank")
    @Size(max = 50, message = "Admission number must not exceed 50 characters")
    String admissionNumber,

    @Email(message = "Email must be a valid address")
    @Size(max = 255, message = "Email must not exceed 255 characters")
    String email,

    @Size(max = 100, message = "Class must not exceed 100 characters")
    String className
) {}
