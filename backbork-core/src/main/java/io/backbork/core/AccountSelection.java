package io.backbork.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Target accounts of a job or schedule.
 *
 * <p>Either an explicit, ordered set of account identifiers, or the wildcard {@code *} meaning
 * "every account the owner can access", resolved through the {@link io.backbork.AccessResolver}
 * at the time the selection is used. The resolved form is never written back to a schedule.
 *
 * <p>Serialized as a JSON array: {@code ["*"]} or {@code ["alice", "bob"]}.
 */
public final class AccountSelection {

    public static final String WILDCARD = "*";

    private static final AccountSelection ALL_ACCESSIBLE = new AccountSelection(null);

    private final List<String> accounts;

    private AccountSelection(List<String> accounts) {
        this.accounts = accounts;
    }

    public static AccountSelection allAccessible() {
        return ALL_ACCESSIBLE;
    }

    /**
     * Explicit accounts, de-duplicated in first-seen order.
     */
    public static AccountSelection explicit(Collection<String> accounts) {
        Objects.requireNonNull(accounts, "accounts must not be null");
        if (accounts.isEmpty()) {
            throw new IllegalArgumentException("accounts must not be empty");
        }
        if (accounts.contains(WILDCARD)) {
            return ALL_ACCESSIBLE;
        }
        LinkedHashSet<String> ordered = new LinkedHashSet<>();
        for (String account : accounts) {
            if (account == null || account.isBlank()) {
                throw new IllegalArgumentException("accounts must not contain blank values");
            }
            ordered.add(account.trim());
        }
        return new AccountSelection(List.copyOf(ordered));
    }

    public static AccountSelection explicit(String... accounts) {
        return explicit(List.of(accounts));
    }

    @JsonCreator
    public static AccountSelection fromList(List<String> values) {
        if (values == null || values.isEmpty()) {
            return new AccountSelection(List.of());
        }
        if (values.contains(WILDCARD)) {
            return ALL_ACCESSIBLE;
        }
        return new AccountSelection(List.copyOf(new LinkedHashSet<>(values)));
    }

    @JsonValue
    public List<String> toList() {
        return accounts == null ? List.of(WILDCARD) : accounts;
    }

    public boolean isAllAccessible() {
        return accounts == null;
    }

    /**
     * Explicit accounts.
     *
     * @throws IllegalStateException for the wildcard selection, which must be resolved first
     */
    public List<String> accounts() {
        if (accounts == null) {
            throw new IllegalStateException("wildcard selection must be resolved before use");
        }
        return accounts;
    }

    public boolean isEmpty() {
        return accounts != null && accounts.isEmpty();
    }

    public List<String> asMutableList() {
        return new ArrayList<>(toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AccountSelection other)) return false;
        return Objects.equals(accounts, other.accounts);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(accounts);
    }

    @Override
    public String toString() {
        return isAllAccessible() ? "AccountSelection[*]" : "AccountSelection" + accounts;
    }
}
