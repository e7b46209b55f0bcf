package com.library.circulation.integration;

import com.library.circulation.dto.request.CreateBookRequest;
import com.library.circulation.dto.request.CreateBorrowRequest;
import com.library.circulation.dto.request.CreateStudentRequest;
import com.library.circulation.dto.response.BookResponse;
import com.library.circulation.dto.response.BorrowRecordResponse;
import com.library.circulation.dto.response.StudentResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class BorrowConcurrencyTest extends AbstractIntegrationTest {

    private static final String BORROW_URL = "/api/v1/borrow-records";
    private static final String BOOKS_URL = "/api/v1/books";
    private static final String STUDENTS_URL = "/api/v1/students";

    @Test
    void concurrentBorrowsOfSingleCopy_onlyOneSucceeds() throws Exception {
        Long bookId = createBook("Concurrent Borrow Book", 1);

        List<ResponseEntity<BorrowRecordResponse>> responses = borrowConcurrently(bookId, 10);

        long successCount = responses.stream()
            .filter(r -> r.getStatusCode() == HttpStatus.CREATED)
            .count();
        long conflictCount = responses.stream()
            .filter(r -> r.getStatusCode() == HttpStatus.CONFLICT)
            .count();

        assertThat(successCount).isEqualTo(1);
        assertThat(conflictCount).isEqualTo(9);
        assertThat(getBook(bookId).availableCopies()).isZero();
    }

    @Test
    void concurrentBorrowsOfThreeCopies_eachCopyLentOnce() throws Exception {
        Long bookId = createBook("Concurrent Multi-Copy Book", 3);

        List<ResponseEntity<BorrowRecordResponse>> responses = borrowConcurrently(bookId, 10);

        List<Long> lentCopies = responses.stream()
            .filter(r -> r.getStatusCode() == HttpStatus.CREATED)
            .map(r -> r.getBody().bookCopyId())
            .toList();

        assertThat(lentCopies).hasSize(3).doesNotHaveDuplicates();
        assertThat(getBook(bookId).availableCopies()).isZero();
    }

    private List<ResponseEntity<BorrowRecordResponse>> borrowConcurrently(Long bookId, int threadCount)
            throws Exception {
        List<Long> studentIds = new ArrayList<>();
        for (int i = 0; i < threadCount; i++) {
            studentIds.add(createStudent("Concurrent Student " + i));
        }

        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<ResponseEntity<BorrowRecordResponse>>> futures = new ArrayList<>();

        for (Long studentId : studentIds) {
            futures.add(executor.submit(() -> {
                startLatch.await();
                var request = new CreateBorrowRequest(studentId, bookId, null, null, null);
                return restTemplate.postForEntity(BORROW_URL, request, BorrowRecordResponse.class);
            }));
        }

        // Release all threads simultaneously
        startLatch.countDown();

        List<ResponseEntity<BorrowRecordResponse>> responses = new ArrayList<>();
        for (Future<ResponseEntity<BorrowRecordResponse>> future : futures) {
            responses.add(future.get());
        }
        executor.shutdown();
        return responses;
    }

    private Long createBook(String title, int copies) {
        var request = new CreateBookRequest(title, "Test Author", null, null, copies, null, null);
        return restTemplate.postForEntity(BOOKS_URL, request, BookResponse.class).getBody().id();
    }

    private Long createStudent(String name) {
        var request = new CreateStudentRequest(name, "ADM-" + UUID.randomUUID().toString().substring(0, 8),
                                               null, null);
        return restTemplate.postForEntity(STUDENTS_URL, request, StudentResponse.class).getBody().id();
    }

    private BookResponse getBook(Long id) {
        return restTemplate.getForEntity(BOOKS_URL + "/" + id, BookResponse.class).getBody();
    }
}
