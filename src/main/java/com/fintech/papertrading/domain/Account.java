package com.fintech.papertrading.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable per-user ledger account: multi-asset balances plus append-only history.
 * Not thread-safe; only mutated by the ledger while it holds the state write lock.
 * Readers outside the lock work on {@link #copy()} snapshots.
 */
public class Account {

    private final String username;
    private final Map<String, Double> balances;
    private final List<Transaction> history;

    public Account(String username) {
        this(username, new LinkedHashMap<>(), new ArrayList<>());
    }

    public Account(String username, Map<String, Double> balances, List<Transaction> history) {
        this.username = Objects.requireNonNull(username, "Username cannot be null");
        this.balances = new LinkedHashMap<>(balances);
        this.history = new ArrayList<>(history);
    }

    /**
     * Creates an account seeded with a starting balance of the reference currency.
     */
    public static Account seeded(String username, String referenceCurrency, double startingBalance) {
        Account account = new Account(username);
        account.balances.put(referenceCurrency, startingBalance);
        return account;
    }

    public String getUsername() {
        return username;
    }

    /** Returns the balance of an asset, 0.0 when the account never held it. */
    public double balance(String asset) {
        return balances.getOrDefault(asset, 0.0);
    }

    /**
     * Adds a (possibly negative) amount to a balance.
     *
     * @throws IllegalStateException if the result would be negative
     */
    public void adjust(String asset, double delta) {
        double updated = balance(asset) + delta;
        if (updated < 0) {
            throw new IllegalStateException(
                "Balance of " + asset + " for " + username + " would become negative: " + updated);
        }
        balances.put(asset, updated);
    }

    public void append(Transaction transaction) {
        history.add(Objects.requireNonNull(transaction, "Transaction cannot be null"));
    }

    public Map<String, Double> getBalances() {
        return Collections.unmodifiableMap(balances);
    }

    public List<Transaction> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /** Deep snapshot; transactions are immutable and shared. */
    public Account copy() {
        return new Account(username, balances, history);
    }
}
