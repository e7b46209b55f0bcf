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

/**
 * One physical, individually trackable item of a {@link Book}.
 *
 * <p>{@link #status} is flipped only by {@code CopyAllocator}, and only inside the
 * transaction that creates or closes the matching {@link BorrowRecord}. The database
 * backs this with the partial unique index {@code idx_borrow_records_open_copy}
 * (at most one BORROWED/OVERDUE record per copy).
 *
 * <p>{@link #catalogCode} is the ISBN-like label printed on the item. Unique across all
 * copies ({@code uq_book_copies_catalog_code}).
 */
@Entity
@Table(name = "book_copies")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class BookCopy extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "book_id", nullable = false)
    private Book book;

    @Column(name = "catalog_code", nullable = false, unique = true, length = 40)
    private String catalogCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CopyStatus status = CopyStatus.AVAILABLE;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public boolean isAvailable() {
        return status == CopyStatus.AVAILABLE;
    }
}
