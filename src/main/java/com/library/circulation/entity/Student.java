package com.library.circulation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * JPA entity representing a library member.
 *
 * <p><strong>Blacklist state</strong>: {@link #blacklisted}, {@link #blacklistUntil} and
 * {@link #blacklistReason} have no setters. They change only through
 * {@link #blacklist(Instant, String)} and {@link #clearBlacklist(String, String, Instant)},
 * which keep the invariant that a non-blacklisted student carries no expiry and no
 * blacklist reason.
 *
 * <p>The {@code unblacklist*} columns record the most recent lift. For an automatic lift
 * {@link #unblacklistAdminId} is {@code null}.
 *
 * <p>{@code blacklistUntil == null} while blacklisted means "until cleared".
 */
@Entity
@Table(name = "students")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Student extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "admission_number", nullable = false, unique = true, length = 50)
    private String admissionNumber;

    @Column(name = "email", length = 255)
    private String email;

    @Column(name = "class_name", length = 100)
    private String className;

    @Setter(AccessLevel.NONE)
    @Column(name = "blacklisted", nullable = false)
    private boolean blacklisted;

    @Setter(AccessLevel.NONE)
    @Column(name = "blacklist_until")
    private Instant blacklistUntil;

    @Setter(AccessLevel.NONE)
    @Column(name = "blacklist_reason", columnDefinition = "TEXT")
    private String blacklistReason;

    @Setter(AccessLevel.NONE)
    @Column(name = "unblacklist_reason", columnDefinition = "TEXT")
    private String unblacklistReason;

    @Setter(AccessLevel.NONE)
    @Column(name = "unblacklist_date")
    private Instant unblacklistDate;

    @Setter(AccessLevel.NONE)
    @Column(name = "unblacklist_admin_id", length = 64)
    private String unblacklistAdminId;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    /**
     * Whether the blacklist still blocks borrowing at {@code now}. A flag whose expiry has
     * passed no longer blocks, even though the flag itself stays set until reconciliation.
     */
    public boolean isBlacklistedAt(Instant now) {
        return blacklisted && (blacklistUntil == null || blacklistUntil.isAfter(now));
    }

    public void blacklist(Instant until, String reason) {
        this.blacklisted = true;
        this.blacklistUntil = until;
        this.blacklistReason = reason;
    }

    /**
     * Lifts the blacklist and stamps the lift.
     *
     * @param adminId {@code null} for an automatic lift
     */
    public void clearBlacklist(String reason, String adminId, Instant at) {
        this.blacklisted = false;
        this.blacklistUntil = null;
        this.blacklistReason = null;
        this.unblacklistReason = reason;
        this.unblacklistAdminId = adminId;
        this.unblacklistDate = at;
    }
}
