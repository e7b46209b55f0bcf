package com.library.circulation.service;

import com.library.circulation.entity.BookCopy;
import com.library.circulation.entity.CopyStatus;
import com.library.circulation.exception.NoAvailableCopyException;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.repository.BookCopyRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Flips {@link BookCopy#getStatus()} between AVAILABLE and BORROWED.
 *
 * <p>Every method requires an existing transaction ({@link Propagation#MANDATORY}): the flip
 * is only ever made inside the transaction that also inserts or closes the borrow record, so
 * a copy can never be observed as BORROWED without its record, or the reverse. Calling it
 * outside one fails with {@code IllegalTransactionStateException}.
 */
@Component
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class CopyAllocator {

    private static final Logger log = LoggerFactory.getLogger(CopyAllocator.class);

    private final BookCopyRepository bookCopyRepository;

    /**
     * Claims any available copy of the book. Which copy is returned is unspecified.
     */
    public BookCopy allocate(Long bookId) {
        BookCopy copy = bookCopyRepository.findFirstByBookIdAndStatus(bookId, CopyStatus.AVAILABLE)
            .orElseThrow(() -> new NoAvailableCopyException(bookId));
        return markBorrowed(copy);
    }

    /**
     * Claims one specific copy. A copy of another book counts as unavailable.
     */
    public BookCopy allocate(Long bookId, Long copyId) {
        BookCopy copy = bookCopyRepository.findByIdForUpdate(copyId)
            .orElseThrow(() -> new ResourceNotFoundException("Book copy", copyId));
        if (!copy.getBook().getId().equals(bookId) || !copy.isAvailable()) {
            throw new NoAvailableCopyException(bookId, copyId);
        }
        return markBorrowed(copy);
    }

    /**
     * Puts the copy back on the shelf. Releasing a copy that is already available is a no-op.
     */
    public void release(Long copyId) {
        BookCopy copy = bookCopyRepository.findByIdForUpdate(copyId)
            .orElseThrow(() -> new ResourceNotFoundException("Book copy", copyId));
        if (copy.isAvailable()) {
            log.debug("Copy {} already available, nothing to release", copyId);
            return;
        }
        copy.setStatus(CopyStatus.AVAILABLE);
        bookCopyRepository.save(copy);
    }

    private BookCopy markBorrowed(BookCopy copy) {
        copy.setStatus(CopyStatus.BORROWED);
        return bookCopyRepository.save(copy);
    }
}
