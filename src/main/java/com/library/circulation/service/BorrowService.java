package com.library.circulation.service;

import com.library.circulation.config.CirculationProperties;
import com.library.circulation.dto.request.CreateBorrowRequest;
import com.library.circulation.dto.response.BorrowRecordResponse;
import com.library.circulation.entity.Book;
import com.library.circulation.entity.BookCopy;
import com.library.circulation.entity.BorrowRecord;
import com.library.circulation.entity.BorrowStatus;
import com.library.circulation.entity.DuePeriodUnit;
import com.library.circulation.entity.Student;
import com.library.circulation.exception.HasOverdueBooksException;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.exception.StudentBlacklistedException;
import com.library.circulation.mapper.BorrowRecordMapper;
import com.library.circulation.repository.BookRepository;
import com.library.circulation.repository.BorrowRecordRepository;
import com.library.circulation.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;

@Service
@RequiredArgsConstructor
public class BorrowService {

    private static final Logger log = LoggerFactory.getLogger(BorrowService.class);

    private final StudentRepository studentRepository;
    private final BookRepository bookRepository;
    private final BorrowRecordRepository borrowRecordRepository;
    private final CopyAllocator copyAllocator;
    private final DueDateCalculator dueDateCalculator;
    private final OverdueSweepService overdueSweepService;
    private final CirculationProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    /**
     * Lends a copy of a book to a student.
     *
     * <p>The pre-borrow sweep commits on its own before the borrow transaction opens. Checks then
     * run in order and stop at the first failure: no unpromoted late loans, student exists,
     * student not actively blacklisted, book exists, a copy can be allocated. The copy flip and
     * the record insert share one transaction, so any failure after the allocation rolls the copy
     * back to AVAILABLE.
     */
    public BorrowRecordResponse borrow(CreateBorrowRequest request) {
        if (properties.sweep().beforeBorrow()) {
            runPreBorrowSweep();
        }
        return transactionTemplate.execute(status -> lend(request));
    }

    private BorrowRecordResponse lend(CreateBorrowRequest request) {
        Instant now = clock.instant();
        Long studentId = request.studentId();

        if (borrowRecordRepository.existsByStudentIdAndStatusAndDueDateBefore(
                studentId, BorrowStatus.BORROWED, now)) {
            throw new HasOverdueBooksException(studentId);
        }

        Student student = studentRepository.findById(studentId)
            .orElseThrow(() -> new ResourceNotFoundException("Student", studentId));
        if (student.isBlacklistedAt(now)) {
            throw new StudentBlacklistedException(studentId, student.getBlacklistUntil());
        }

        Book book = bookRepository.findById(request.bookId())
            .orElseThrow(() -> new ResourceNotFoundException("Book", request.bookId()));

        BookCopy copy = request.bookCopyId() == null
            ? copyAllocator.allocate(book.getId())
            : copyAllocator.allocate(book.getId(), request.bookCopyId());

        BorrowRecord record = new BorrowRecord();
        record.setBookCopy(copy);
        record.setStudent(student);
        record.setBorrowDate(now);
        record.setDueDate(computeDueDate(now, request, book));
        record.setStatus(BorrowStatus.BORROWED);
        record.setStudentName(student.getName());
        record.setStudentAdmissionNumber(student.getAdmissionNumber());
        record.setStudentClass(student.getClassName());
        record.setBookTitle(book.getTitle());
        record.setBookAuthor(book.getAuthor());
        record.setBookCatalogCode(copy.getCatalogCode());

        BorrowRecord saved = borrowRecordRepository.saveAndFlush(record);
        log.info("Copy {} ({}) lent to student {} until {}",
                 copy.getId(), copy.getCatalogCode(), studentId, saved.getDueDate());
        return BorrowRecordMapper.toResponse(saved);
    }

    /**
     * Closes a loan and puts its copy back on the shelf. Returning a record that is already
     * RETURNED changes nothing and answers with the record as it stands.
     */
    @Transactional
    public BorrowRecordResponse returnBook(Long recordId) {
        BorrowRecord record = borrowRecordRepository.findByIdForUpdate(recordId)
            .orElseThrow(() -> new ResourceNotFoundException("Borrow record", recordId));

        if (record.getStatus() == BorrowStatus.RETURNED) {
            return BorrowRecordMapper.toResponse(record);
        }

        record.setStatus(BorrowStatus.RETURNED);
        record.setReturnDate(clock.instant());
        copyAllocator.release(record.getBookCopy().getId());

        BorrowRecord saved = borrowRecordRepository.save(record);
        log.info("Borrow record {} returned, copy {} released", recordId, record.getBookCopy().getId());
        return BorrowRecordMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public BorrowRecordResponse findById(Long id) {
        BorrowRecord record = borrowRecordRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Borrow record", id));
        return BorrowRecordMapper.toResponse(record);
    }

    @Transactional(readOnly = true)
    public Page<BorrowRecordResponse> findAll(Long studentId, Long bookId, BorrowStatus status,
                                              Pageable pageable) {
        Specification<BorrowRecord> spec = Specification.where(null);

        if (studentId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("student").get("id"), studentId));
        }
        if (bookId != null) {
            spec = spec.and((root, query, cb) ->
                cb.equal(root.get("bookCopy").get("book").get("id"), bookId));
        }
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }

        return borrowRecordRepository.findAll(spec, pageable)
            .map(BorrowRecordMapper::toResponse);
    }

    private Instant computeDueDate(Instant now, CreateBorrowRequest request, Book book) {
        int value = request.duePeriodValue() != null ? request.duePeriodValue() : book.getDuePeriodValue();
        DuePeriodUnit unit = request.duePeriodUnit() != null
            ? DuePeriodUnit.parse(request.duePeriodUnit())
            : book.getDuePeriodUnit();
        return dueDateCalculator.computeDueDate(now, value, unit);
    }

    private void runPreBorrowSweep() {
        try {
            overdueSweepService.sweep();
        } catch (RuntimeException e) {
            log.warn("Overdue sweep before borrow failed, continuing with borrow", e);
        }
    }
}
