package com.library.circulation.entity;

/**
 * Lifecycle states for a {@link BorrowRecord}.
 *
 * <ul>
 *   <li>{@link #BORROWED} initial state, set by the borrow operation</li>
 *   <li>{@link #OVERDUE}  set only by the overdue sweep once the grace window has passed</li>
 *   <li>{@link #RETURNED} terminal, set by the return operation</li>
 * </ul>
 */
public enum BorrowStatus {
    BORROWED,
    OVERDUE,
    RETURNED
}
