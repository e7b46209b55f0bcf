package com.library.circulation.exception;

public class InvalidUnblacklistReasonException extends CirculationException {

    public InvalidUnblacklistReasonException(int minLength) {
        super("INVALID_REASON",
            "Unblacklist reason is required and must be at least " + minLength + " characters long");
    }
}
