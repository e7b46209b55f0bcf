package com.library.circulation.exception;

public class MissingAdminException extends CirculationException {

    public MissingAdminException() {
        super("MISSING_ADMIN", "Admin ID is required for unblacklist operation");
    }
}
