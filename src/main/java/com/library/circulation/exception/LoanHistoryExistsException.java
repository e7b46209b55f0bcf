package com.library.circulation.exception;

public class LoanHistoryExistsException extends CirculationException {

    public LoanHistoryExistsException(String message) {
        super("LOAN_HISTORY_EXISTS", message);
    }
}
