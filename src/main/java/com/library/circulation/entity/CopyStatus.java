package com.library.circulation.entity;

/**
 * Allocation state of a {@link BookCopy}. This column is the only allocation signal;
 * there is no separate lock table.
 */
public enum CopyStatus {
    AVAILABLE,
    BORROWED
}
