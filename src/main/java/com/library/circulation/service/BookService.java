package com.library.circulation.service;

import com.library.circulation.dto.request.AddCopiesRequest;
import com.library.circulation.dto.request.CreateBookRequest;
import com.library.circulation.dto.request.UpdateBookRequest;
import com.library.circulation.dto.response.BookResponse;
import com.library.circulation.entity.Book;
import com.library.circulation.entity.BookCopy;
import com.library.circulation.exception.DuplicateCatalogCodeException;
import com.library.circulation.exception.LoanHistoryExistsException;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.mapper.BookMapper;
import com.library.circulation.repository.BookCopyRepository;
import com.library.circulation.repository.BookRepository;
import com.library.circulation.repository.BorrowRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.concurrent.ThreadLocalRandom;

@Service
@RequiredArgsConstructor
public class BookService {

    static final String GENERATED_CODE_PREFIX = "LIB-";

    private final BookRepository bookRepository;
    private final BookCopyRepository bookCopyRepository;
    private final BorrowRecordRepository borrowRecordRepository;

    @Transactional(readOnly = true)
    public Page<BookResponse> findAll(Pageable pageable) {
        return bookRepository.findAll(pageable)
            .map(BookMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public BookResponse findById(Long id) {
        Book book = bookRepository.findByIdWithCopies(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));
        return BookMapper.toResponse(book);
    }

    /**
     * Creates the book and its copies. With an ISBN the first copy carries it verbatim and
     * further copies get {@code isbn-2}, {@code isbn-3}, ...; without one every copy gets a
     * generated {@code LIB-} code.
     */
    @Transactional
    public BookResponse create(CreateBookRequest request) {
        Book book = BookMapper.toEntity(request);
        String isbn = request.isbn() == null || request.isbn().isBlank() ? null : request.isbn().trim();

        for (int i = 0; i < request.totalCopies(); i++) {
            String code = isbn == null ? generateCatalogCode() : (i == 0 ? isbn : isbn + "-" + (i + 1));
            if (isbn != null && bookCopyRepository.existsByCatalogCode(code)) {
                throw new DuplicateCatalogCodeException(code);
            }
            book.addCopy(newCopy(code));
        }

        Book saved = bookRepository.save(book);
        return BookMapper.toResponse(saved);
    }

    @Transactional
    public BookResponse addCopies(Long id, AddCopiesRequest request) {
        Book book = bookRepository.findByIdWithCopies(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));

        for (int i = 0; i < request.count(); i++) {
            BookCopy copy = newCopy(generateCatalogCode());
            book.addCopy(copy);
            bookCopyRepository.save(copy);
        }
        return BookMapper.toResponse(book);
    }

    @Transactional
    public BookResponse update(Long id, UpdateBookRequest request) {
        Book book = bookRepository.findByIdWithCopies(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));

        BookMapper.updateEntity(book, request);
        Book saved = bookRepository.save(book);
        return BookMapper.toResponse(saved);
    }

    @Transactional
    public void delete(Long id) {
        Book book = bookRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));

        if (borrowRecordRepository.existsByBookCopyBookId(id)) {
            throw new LoanHistoryExistsException("Cannot delete a book with borrowing history");
        }

        bookRepository.delete(book);
    }

    private BookCopy newCopy(String catalogCode) {
        BookCopy copy = new BookCopy();
        copy.setCatalogCode(catalogCode);
        return copy;
    }

    private String generateCatalogCode() {
        String code;
        do {
            code = GENERATED_CODE_PREFIX + ThreadLocalRandom.current().nextLong(1_000_000_000L, 10_000_000_000L);
        } while (bookCopyRepository.existsByCatalogCode(code));
        return code;
    }
}
