package com.library.circulation.exception;

public class DuplicateAdmissionNumberException extends CirculationException {

    public DuplicateAdmissionNumberException(String admissionNumber) {
        super("DUPLICATE_ADMISSION_NUMBER", "Admission number already exists: " + admissionNumber);
    }
}
