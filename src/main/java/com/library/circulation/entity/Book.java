package com.library.circulation.entity;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.BatchSize;

import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity representing a catalogue title. The physical items on the shelf are its
 * {@link BookCopy} rows; a Book itself is never borrowed.
 *
 * <p><strong>Default loan period</strong>: {@link #duePeriodValue} and {@link #duePeriodUnit}
 * are used by the borrow operation whenever the request does not carry its own period.
 * New books default to 24 hours.
 *
 * <p><strong>copies</strong> cascades {@code PERSIST} only, so a new Book saved together
 * with its initial copies inserts them in one statement batch. Copies are never removed
 * through this collection; a book with any borrowing history cannot be deleted at all.
 *
 * <p>{@code @ToString} is omitted so that logging a Book never initialises {@code copies}.
 */
@Entity
@Table(name = "books")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Book extends BaseEntity {

    public static final int DEFAULT_DUE_PERIOD_VALUE = 24;
    public static final DuePeriodUnit DEFAULT_DUE_PERIOD_UNIT = DuePeriodUnit.HOURS;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "author", nullable = false, length = 255)
    private String author;

    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "due_period_value", nullable = false)
    private Integer duePeriodValue = DEFAULT_DUE_PERIOD_VALUE;

    @Enumerated(EnumType.STRING)
    @Column(name = "due_period_unit", nullable = false, length = 20)
    private DuePeriodUnit duePeriodUnit = DEFAULT_DUE_PERIOD_UNIT;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    @OneToMany(mappedBy = "book", fetch = FetchType.LAZY, cascade = CascadeType.PERSIST)
    @OrderBy("id ASC")
    @BatchSize(size = 20)
    private List<BookCopy> copies = new ArrayList<>();

    public void addCopy(BookCopy copy) {
        copy.setBook(this);
        copies.add(copy);
    }
}
