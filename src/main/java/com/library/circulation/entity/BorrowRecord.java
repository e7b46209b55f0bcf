package com.library.circulation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Ledger entry for one loan of one {@link BookCopy} to one {@link Student}.
 *
 * <p>Rows are never deleted. A record is created only by {@code BorrowService.borrow()}
 * in state {@link BorrowStatus#BORROWED}, moves to {@link BorrowStatus#OVERDUE} only through
 * the overdue sweep, and ends in {@link BorrowStatus#RETURNED}.
 *
 * <p>At most one record per copy may be open (BORROWED or OVERDUE). Enforced by the
 * partial unique index {@code idx_borrow_records_open_copy} (V3 migration):
 * <pre>
 *   CREATE UNIQUE INDEX idx_borrow_records_open_copy
 *       ON borrow_records (book_copy_id) WHERE status IN ('BORROWED', 'OVERDUE');
 * </pre>
 *
 * <p><strong>Snapshot columns</strong>: student name/admission number/class and book
 * title/author/catalog code are copied in at creation time and never refreshed, so
 * historical reports keep showing what was true when the loan was made.
 */
@Entity
@Table(name = "borrow_records")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class BorrowRecord extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "book_copy_id", nullable = false, updatable = false)
    private BookCopy bookCopy;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "student_id", nullable = false, updatable = false)
    private Student student;

    @Column(name = "borrow_date", nullable = false, updatable = false)
    private Instant borrowDate;

    @Column(name = "due_date", nullable = false)
    private Instant dueDate;

    @Column(name = "return_date")
    private Instant returnDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BorrowStatus status;

    @Column(name = "student_name", length = 255, updatable = false)
    private String studentName;

    @Column(name = "student_admission_number", length = 50, updatable = false)
    private String studentAdmissionNumber;

    @Column(name = "student_class", length = 100, updatable = false)
    private String studentClass;

    @Column(name = "book_title", length = 500, updatable = false)
    private String bookTitle;

    @Column(name = "book_author", length = 255, updatable = false)
    private String bookAuthor;

    @Column(name = "book_catalog_code", length = 40, updatable = false)
    private String bookCatalogCode;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;
}
