package com.fintech.papertrading.persistence;

import com.fintech.papertrading.domain.Account;

import java.util.Map;

/**
 * Durable mirror of ledger accounts.
 * The in-memory ledger is authoritative; implementations only store snapshots.
 */
public interface AccountStore {

    /**
     * Loads every persisted account keyed by user id.
     */
    Map<String, Account> loadAll();

    /**
     * Upserts an account snapshot. Saving the same snapshot twice must be safe.
     */
    void save(String userId, Account account);

    /**
     * Removes an account if present.
     */
    void delete(String userId);

    long count();

    boolean isHealthy();
}
