package com.library.circulation.exception;

public class StudentNotBlacklistedException extends CirculationException {

    public StudentNotBlacklistedException(Long studentId) {
        super("NOT_BLACKLISTED", "Student " + studentId + " is not currently blacklisted");
    }
}
