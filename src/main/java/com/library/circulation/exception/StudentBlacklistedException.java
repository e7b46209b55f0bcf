package com.library.circulation.exception;

import java.time.Instant;

public class StudentBlacklistedException extends CirculationException {

    public StudentBlacklistedException(Long studentId, Instant blacklistUntil) {
        super("STUDENT_BLACKLISTED", "Student " + studentId + " is blacklisted "
            + (blacklistUntil == null ? "until cleared by an admin" : "until " + blacklistUntil)
            + " and cannot borrow books");
    }
}
