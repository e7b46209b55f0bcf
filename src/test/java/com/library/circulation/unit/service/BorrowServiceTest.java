package com.library.circulation.unit.service;

import com.library.circulation.config.CirculationProperties;
import com.library.circulation.dto.request.CreateBorrowRequest;
import com.library.circulation.dto.response.BorrowRecordResponse;
import com.library.circulation.entity.Book;
import com.library.circulation.entity.BookCopy;
import com.library.circulation.entity.BorrowRecord;
import com.library.circulation.entity.BorrowStatus;
import com.library.circulation.entity.CopyStatus;
import com.library.circulation.entity.DuePeriodUnit;
import com.library.circulation.entity.Student;
import com.library.circulation.exception.HasOverdueBooksException;
import com.library.circulation.exception.NoAvailableCopyException;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.exception.StudentBlacklistedException;
import com.library.circulation.repository.BookRepository;
import com.library.circulation.repository.BorrowRecordRepository;
import com.library.circulation.repository.StudentRepository;
import com.library.circulation.service.BorrowService;
import com.library.circulation.service.CopyAllocator;
import com.library.circulation.service.DueDateCalculator;
import com.library.circulation.service.OverdueSweepService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BorrowServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-06T10:00:00Z");

    @Mock
    private StudentRepository studentRepository;

    @Mock
    private BookRepository bookRepository;

    @Mock
    private BorrowRecordRepository borrowRecordRepository;

    @Mock
    private CopyAllocator copyAllocator;

    @Mock
    private OverdueSweepService overdueSweepService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private BorrowService borrowService;

    @BeforeEach
    void setUp() {
        CirculationProperties properties = new CirculationProperties(
            Duration.ofDays(1), ZoneOffset.UTC,
            new CirculationProperties.Sweep(true, Duration.ofMinutes(15), true),
            new CirculationProperties.Blacklist(false));
        borrowService = new BorrowService(studentRepository, bookRepository, borrowRecordRepository,
            copyAllocator, new DueDateCalculator(ZoneOffset.UTC), overdueSweepService, properties,
            Clock.fixed(NOW, ZoneOffset.UTC), new TransactionTemplate(transactionManager));
    }

    @Test
    void borrow_withBookDefaults_createsRecordDueIn24Hours() {
        Student student = createTestStudent(1L);
        Book book = createTestBook(2L);
        BookCopy copy = createTestCopy(3L, book);
        when(studentRepository.findById(1L)).thenReturn(Optional.of(student));
        when(bookRepository.findById(2L)).thenReturn(Optional.of(book));
        when(copyAllocator.allocate(2L)).thenReturn(copy);
        when(borrowRecordRepository.saveAndFlush(any(BorrowRecord.class))).thenAnswer(invocation -> {
            BorrowRecord saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", 100L);
            return saved;
        });

        BorrowRecordResponse response = borrowService.borrow(new CreateBorrowRequest(1L, 2L, null, null, null));

        assertThat(response.id()).isEqualTo(100L);
        assertThat(response.status()).isEqualTo(BorrowStatus.BORROWED);
        assertThat(response.borrowDate()).isEqualTo(NOW);
        assertThat(response.dueDate()).isEqualTo(NOW.plus(Duration.ofHours(24)));
        assertThat(response.bookCopyId()).isEqualTo(3L);
        assertThat(response.studentName()).isEqualTo("Ada Obi");
        assertThat(response.studentAdmissionNumber()).isEqualTo("ADM-1");
        assertThat(response.bookTitle()).isEqualTo("Things Fall Apart");
        assertThat(response.bookCatalogCode()).isEqualTo("LIB-3");
        verify(overdueSweepService).sweep();
    }

    @Test
    void borrow_withRequestPeriod_overridesBookDefault() {
        stubSuccessfulBorrow();

        BorrowRecordResponse response =
            borrowService.borrow(new CreateBorrowRequest(1L, 2L, null, 2, "weeks"));

        assertThat(response.dueDate()).isEqualTo(NOW.plus(Duration.ofDays(14)));
    }

    @Test
    void borrow_withValueOnly_usesBookUnit() {
        Book book = stubSuccessfulBorrow();
        book.setDuePeriodUnit(DuePeriodUnit.DAYS);

        BorrowRecordResponse response =
            borrowService.borrow(new CreateBorrowRequest(1L, 2L, null, 3, null));

        assertThat(response.dueDate()).isEqualTo(NOW.plus(Duration.ofDays(3)));
    }

    @Test
    void borrow_withPeriodBeyondLatestDueDate_isRejectedBeforeSaving() {
        Book book = createTestBook(2L);
        when(studentRepository.findById(1L)).thenReturn(Optional.of(createTestStudent(1L)));
        when(bookRepository.findById(2L)).thenReturn(Optional.of(book));
        when(copyAllocator.allocate(2L)).thenReturn(createTestCopy(3L, book));

        assertThatThrownBy(() -> borrowService.borrow(
                new CreateBorrowRequest(1L, 2L, null, Integer.MAX_VALUE, "years")))
            .isInstanceOf(IllegalArgumentException.class);
        verify(borrowRecordRepository, never()).saveAndFlush(any());
    }

    @Test
    void borrow_withUnknownUnit_fallsBackTo24Hours() {
        stubSuccessfulBorrow();

        BorrowRecordResponse response =
            borrowService.borrow(new CreateBorrowRequest(1L, 2L, null, 3, "fortnights"));

        assertThat(response.dueDate()).isEqualTo(NOW.plus(Duration.ofHours(24)));
    }

    @Test
    void borrow_withSpecificCopy_allocatesThatCopy() {
        Student student = createTestStudent(1L);
        Book book = createTestBook(2L);
        when(studentRepository.findById(1L)).thenReturn(Optional.of(student));
        when(bookRepository.findById(2L)).thenReturn(Optional.of(book));
        when(copyAllocator.allocate(2L, 7L)).thenReturn(createTestCopy(7L, book));
        when(borrowRecordRepository.saveAndFlush(any(BorrowRecord.class))).thenAnswer(i -> i.getArgument(0));

        BorrowRecordResponse response = borrowService.borrow(new CreateBorrowRequest(1L, 2L, 7L, null, null));

        assertThat(response.bookCopyId()).isEqualTo(7L);
        verify(copyAllocator, never()).allocate(anyLong());
    }

    @Test
    void borrow_withUnpromotedLateLoan_throwsHasOverdueBooks() {
        when(borrowRecordRepository.existsByStudentIdAndStatusAndDueDateBefore(1L, BorrowStatus.BORROWED, NOW))
            .thenReturn(true);

        assertThatThrownBy(() -> borrowService.borrow(new CreateBorrowRequest(1L, 2L, null, null, null)))
            .isInstanceOf(HasOverdueBooksException.class);
        verify(copyAllocator, never()).allocate(anyLong());
        verify(borrowRecordRepository, never()).saveAndFlush(any());
    }

    @Test
    void borrow_withUnknownStudent_throwsResourceNotFound() {
        when(studentRepository.findById(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> borrowService.borrow(new CreateBorrowRequest(1L, 2L, null, null, null)))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining("Student");
    }

    @Test
    void borrow_withActiveBlacklist_throwsStudentBlacklisted() {
        Student student = createTestStudent(1L);
        student.blacklist(NOW.plus(Duration.ofDays(3)), "Automatic blacklist");
        when(studentRepository.findById(1L)).thenReturn(Optional.of(student));

        assertThatThrownBy(() -> borrowService.borrow(new CreateBorrowRequest(1L, 2L, null, null, null)))
            .isInstanceOf(StudentBlacklistedException.class);
        verify(copyAllocator, never()).allocate(anyLong());
    }

    @Test
    void borrow_withExpiredBlacklist_isAllowed() {
        Student student = createTestStudent(1L);
        student.blacklist(NOW.minus(Duration.ofHours(1)), "Automatic blacklist");
        Book book = createTestBook(2L);
        when(studentRepository.findById(1L)).thenReturn(Optional.of(student));
        when(bookRepository.findById(2L)).thenReturn(Optional.of(book));
        when(copyAllocator.allocate(2L)).thenReturn(createTestCopy(3L, book));
        when(borrowRecordRepository.saveAndFlush(any(BorrowRecord.class))).thenAnswer(i -> i.getArgument(0));

        BorrowRecordResponse response = borrowService.borrow(new CreateBorrowRequest(1L, 2L, null, null, null));

        assertThat(response.status()).isEqualTo(BorrowStatus.BORROWED);
    }

    @Test
    void borrow_whenNoCopyAvailable_propagatesAndSavesNothing() {
        when(studentRepository.findById(1L)).thenReturn(Optional.of(createTestStudent(1L)));
        when(bookRepository.findById(2L)).thenReturn(Optional.of(createTestBook(2L)));
        when(copyAllocator.allocate(2L)).thenThrow(new NoAvailableCopyException(2L));

        assertThatThrownBy(() -> borrowService.borrow(new CreateBorrowRequest(1L, 2L, null, null, null)))
            .isInstanceOf(NoAvailableCopyException.class);
        verify(borrowRecordRepository, never()).saveAndFlush(any());
        verify(transactionManager).rollback(any());
    }

    @Test
    void borrow_whenPreBorrowSweepFails_stillLends() {
        stubSuccessfulBorrow();
        when(overdueSweepService.sweep()).thenThrow(new IllegalStateException("lock timeout"));

        BorrowRecordResponse response = borrowService.borrow(new CreateBorrowRequest(1L, 2L, null, null, null));

        assertThat(response.status()).isEqualTo(BorrowStatus.BORROWED);
    }

    @Test
    void returnBook_openRecord_closesItAndReleasesCopy() {
        BorrowRecord record = createTestRecord(50L, BorrowStatus.OVERDUE);
        when(borrowRecordRepository.findByIdForUpdate(50L)).thenReturn(Optional.of(record));
        when(borrowRecordRepository.save(record)).thenReturn(record);

        BorrowRecordResponse response = borrowService.returnBook(50L);

        assertThat(response.status()).isEqualTo(BorrowStatus.RETURNED);
        assertThat(response.returnDate()).isEqualTo(NOW);
        verify(copyAllocator).release(3L);
    }

    @Test
    void returnBook_alreadyReturned_changesNothing() {
        BorrowRecord record = createTestRecord(50L, BorrowStatus.RETURNED);
        Instant returnedAt = NOW.minus(Duration.ofDays(2));
        record.setReturnDate(returnedAt);
        when(borrowRecordRepository.findByIdForUpdate(50L)).thenReturn(Optional.of(record));

        BorrowRecordResponse response = borrowService.returnBook(50L);

        assertThat(response.returnDate()).isEqualTo(returnedAt);
        verify(copyAllocator, never()).release(anyLong());
    }

    @Test
    void returnBook_notFound_throwsResourceNotFound() {
        when(borrowRecordRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> borrowService.returnBook(99L))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining("Borrow record");
    }

    private Book stubSuccessfulBorrow() {
        Student student = createTestStudent(1L);
        Book book = createTestBook(2L);
        when(studentRepository.findById(1L)).thenReturn(Optional.of(student));
        when(bookRepository.findById(2L)).thenReturn(Optional.of(book));
        when(copyAllocator.allocate(2L)).thenReturn(createTestCopy(3L, book));
        when(borrowRecordRepository.saveAndFlush(any(BorrowRecord.class))).thenAnswer(i -> i.getArgument(0));
        return book;
    }

    private Student createTestStudent(Long id) {
        Student student = new Student();
        ReflectionTestUtils.setField(student, "id", id);
        student.setName("Ada Obi");
        student.setAdmissionNumber("ADM-" + id);
        student.setClassName("JSS2");
        return student;
    }

    private Book createTestBook(Long id) {
        Book book = new Book();
        ReflectionTestUtils.setField(book, "id", id);
        book.setTitle("Things Fall Apart");
        book.setAuthor("Chinua Achebe");
        return book;
    }

    private BookCopy createTestCopy(Long id, Book book) {
        BookCopy copy = new BookCopy();
        ReflectionTestUtils.setField(copy, "id", id);
        copy.setCatalogCode("LIB-" + id);
        copy.setStatus(CopyStatus.BORROWED);
        book.addCopy(copy);
        return copy;
    }

    private BorrowRecord createTestRecord(Long id, BorrowStatus status) {
        Book book = createTestBook(2L);
        BorrowRecord record = new BorrowRecord();
        ReflectionTestUtils.setField(record, "id", id);
        record.setBookCopy(createTestCopy(3L, book));
        record.setStudent(createTestStudent(1L));
        record.setBorrowDate(NOW.minus(Duration.ofDays(5)));
        record.setDueDate(NOW.minus(Duration.ofDays(4)));
        record.setStatus(status);
        return record;
    }
}
