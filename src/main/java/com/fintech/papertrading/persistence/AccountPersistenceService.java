package com.fintech.papertrading.persistence;

import com.fintech.papertrading.config.TradingProperties;
import com.fintech.papertrading.domain.Account;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget mirror of ledger accounts to the {@link AccountStore}.
 *
 * <p>At-most-once and best-effort: failures are logged, never retried and never
 * surfaced to the caller whose mutation triggered the save. A crash between a
 * mutation and its save loses that mutation from durable storage.
 *
 * <p>Saves run on a single writer thread, so snapshots of one account reach the
 * store in the order the ledger produced them.
 */
@Service
public class AccountPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(AccountPersistenceService.class);

    private final AccountStore store;
    private final CircuitBreaker circuitBreaker;
    private final TradingProperties properties;
    private final ExecutorService writer;

    public AccountPersistenceService(
            AccountStore store,
            CircuitBreakerRegistry circuitBreakerRegistry,
            TradingProperties properties) {
        this.store = store;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("accountStore");
        this.properties = properties;
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "account-writer");
            thread.setDaemon(true);
            return thread;
        });

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Account store circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    /**
     * Queues an account snapshot for saving. The demo account is never persisted.
     */
    public void mirror(String userId, Account snapshot) {
        if (!properties.getPersistence().isEnabled() || isDemoUser(userId)) {
            return;
        }
        writer.execute(() -> save(userId, snapshot));
    }

    /**
     * Loads persisted accounts, excluding the demo identity. Returns an empty map when
     * the store is unreachable so the service can still start.
     */
    public Map<String, Account> loadAll() {
        if (!properties.getPersistence().isEnabled()) {
            return Collections.emptyMap();
        }
        Map<String, Account> accounts;
        try {
            accounts = new HashMap<>(circuitBreaker.executeSupplier(store::loadAll));
        } catch (Exception e) {
            log.error("Failed to load accounts from database, starting empty", e);
            return Collections.emptyMap();
        }
        if (accounts.remove(properties.getDemoUserId()) != null) {
            deleteDemoRow();
        }
        return accounts;
    }

    private void deleteDemoRow() {
        String demoUserId = properties.getDemoUserId();
        try {
            circuitBreaker.executeRunnable(() -> store.delete(demoUserId));
            log.info("Removed persisted demo account {}", demoUserId);
        } catch (Exception e) {
            log.warn("Failed to remove persisted demo account {}, keeping loaded accounts", demoUserId, e);
        }
    }

    private void save(String userId, Account snapshot) {
        try {
            circuitBreaker.executeRunnable(() -> store.save(userId, snapshot));
        } catch (CallNotPermittedException e) {
            log.warn("Account store circuit breaker OPEN - save skipped: user={}", userId);
        } catch (Exception e) {
            log.error("Failed to persist account {} to database", userId, e);
        }
    }

    private boolean isDemoUser(String userId) {
        return properties.getDemoUserId().equals(userId);
    }

    @PreDestroy
    public void shutdown() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Account writer did not drain within 5s, pending saves dropped");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }
}
