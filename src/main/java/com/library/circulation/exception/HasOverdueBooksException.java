package com.library.circulation.exception;

public class HasOverdueBooksException extends CirculationException {

    public HasOverdueBooksException(Long studentId) {
        super("HAS_OVERDUE_BOOKS", "Student " + studentId
            + " has overdue books and cannot borrow until they are returned");
    }
}
