package com.library.circulation.exception;

public class NoAvailableCopyException extends CirculationException {

    public NoAvailableCopyException(Long bookId) {
        super("NO_AVAILABLE_COPY", "Book " + bookId + " has no available copy");
    }

    public NoAvailableCopyException(Long bookId, Long copyId) {
        super("NO_AVAILABLE_COPY", "Copy " + copyId + " of book " + bookId + " is not available for borrowing");
    }
}
