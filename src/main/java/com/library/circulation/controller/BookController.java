package com.library.circulation.controller;

import com.library.circulation.dto.request.AddCopiesRequest;
import com.library.circulation.dto.request.CreateBookRequest;
import com.library.circulation.dto.request.UpdateBookRequest;
import com.library.circulation.dto.response.BookResponse;
import com.library.circulation.dto.response.PagedResponse;
import com.library.circulation.service.BookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/books")
@RequiredArgsConstructor
@Tag(name = "Books", description = "Book and copy management")
public class BookController {

    private final BookService bookService;

    @GetMapping
    @Operation(summary = "List all books", description = "Returns a paginated list of books with copy availability.")
    public ResponseEntity<PagedResponse<BookResponse>> findAll(Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(bookService.findAll(pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get book by ID")
    @ApiResponse(responseCode = "200", description = "Book found")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<BookResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(bookService.findById(id));
    }

    @PostMapping
    @Operation(summary = "Create a new book", description = "Creates the book with totalCopies copies. "
        + "The default loan period is 24 hours unless given.")
    @ApiResponse(responseCode = "201", description = "Book created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "409", description = "Catalog code already exists")
    public ResponseEntity<BookResponse> create(@Valid @RequestBody CreateBookRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bookService.create(request));
    }

    @PostMapping("/{id}/copies")
    @Operation(summary = "Add copies to a book", description = "New copies get generated catalog codes.")
    @ApiResponse(responseCode = "200", description = "Copies added")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<BookResponse> addCopies(@PathVariable Long id,
                                                  @Valid @RequestBody AddCopiesRequest request) {
        return ResponseEntity.ok(bookService.addCopies(id, request));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a book", description = "Partial metadata update; null fields are ignored.")
    @ApiResponse(responseCode = "200", description = "Book updated")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<BookResponse> update(@PathVariable Long id,
                                               @Valid @RequestBody UpdateBookRequest request) {
        return ResponseEntity.ok(bookService.update(id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a book", description = "Returns 409 if any copy has borrowing history.")
    @ApiResponse(responseCode = "204", description = "Book deleted")
    @ApiResponse(responseCode = "404", description = "Book not found")
    @ApiResponse(responseCode = "409", description = "Book has borrowing history")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        bookService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
