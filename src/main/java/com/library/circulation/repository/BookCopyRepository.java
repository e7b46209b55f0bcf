package com.library.circulation.repository;

import com.library.circulation.entity.BookCopy;
import com.library.circulation.entity.CopyStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface BookCopyRepository extends JpaRepository<BookCopy, Long> {

    /**
     * Picks any one available copy of the book and row-locks it.
     *
     * <p>A lock timeout of {@code -2} is Hibernate's {@code LockOptions.SKIP_LOCKED}, rendered
     * as {@code FOR UPDATE SKIP LOCKED} on PostgreSQL. A copy already locked by a concurrent
     * borrow is skipped rather than waited on, so two borrowers never receive the same copy
     * and neither blocks while another copy is free.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    Optional<BookCopy> findFirstByBookIdAndStatus(Long bookId, CopyStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT c FROM BookCopy c JOIN FETCH c.book WHERE c.id = :id")
    Optional<BookCopy> findByIdForUpdate(@Param("id") Long id);

    boolean existsByCatalogCode(String catalogCode);

    long countByBookId(Long bookId);
}
