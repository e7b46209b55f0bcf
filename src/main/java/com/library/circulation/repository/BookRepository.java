package com.library.circulation.repository;

import com.library.circulation.entity.Book;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface BookRepository extends JpaRepository<Book, Long> {

    @Query("SELECT b FROM Book b LEFT JOIN FETCH b.copies WHERE b.id = :id")
    Optional<Book> findByIdWithCopies(@Param("id") Long id);
}
