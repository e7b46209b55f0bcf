package com.library.circulation.mapper;

import com.library.circulation.dto.request.CreateBookRequest;
import com.library.circulation.dto.request.UpdateBookRequest;
import com.library.circulation.dto.response.BookResponse;
import com.library.circulation.entity.Book;
import com.library.circulation.entity.BookCopy;
import com.library.circulation.entity.DuePeriodUnit;

import java.util.List;

public final class BookMapper {

    private BookMapper() {}

    public static Book toEntity(CreateBookRequest request) {
        Book book = new Book();
        book.setTitle(request.title());
        book.setAuthor(request.author());
        book.setCategory(request.category());
        if (request.duePeriodValue() != null) {
            book.setDuePeriodValue(request.duePeriodValue());
        }
        DuePeriodUnit unit = DuePeriodUnit.parse(request.duePeriodUnit());
        if (unit != null) {
            book.setDuePeriodUnit(unit);
        }
        return book;
    }

    public static BookResponse toResponse(Book book) {
        List<BookResponse.CopySummary> copies = book.getCopies().stream()
            .map(c -> new BookResponse.CopySummary(c.getId(), c.getCatalogCode(), c.getStatus()))
            .toList();
        long available = book.getCopies().stream()
            .filter(BookCopy::isAvailable)
            .count();

        return new BookResponse(
            book.getId(),
            book.getTitle(),
            book.getAuthor(),
            book.getCategory(),
            book.getDuePeriodValue(),
            book.getDuePeriodUnit(),
            copies.size(),
            available,
            copies,
            book.getCreatedAt(),
            book.getUpdatedAt()
        );
    }

    public static void updateEntity(Book book, UpdateBookRequest request) {
        if (request.title() != null) {
            book.setTitle(request.title());
        }
        if (request.author() != null) {
            book.setAuthor(request.author());
        }
        if (request.category() != null) {
            book.setCategory(request.category());
        }
        if (request.duePeriodValue() != null) {
            book.setDuePeriodValue(request.duePeriodValue());
        }
        DuePeriodUnit unit = DuePeriodUnit.parse(request.duePeriodUnit());
        if (unit != null) {
            book.setDuePeriodUnit(unit);
        }
    }
}
