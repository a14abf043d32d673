package com.fintech.papertrading.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.papertrading.domain.Account;
import com.fintech.papertrading.domain.Transaction;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Relational implementation of {@link AccountStore} backed by Spring Data JPA.
 * One row per user; balances and history are serialized with Jackson.
 */
@Repository
public class JpaAccountStore implements AccountStore {

    private static final Logger log = LoggerFactory.getLogger(JpaAccountStore.class);

    private static final TypeReference<LinkedHashMap<String, Double>> BALANCES = new TypeReference<>() { };
    private static final TypeReference<List<Transaction>> HISTORY = new TypeReference<>() { };

    private final AccountJpaRepository jpaRepository;
    private final ObjectMapper objectMapper;

    private final AtomicLong writeCounter = new AtomicLong(0);
    private final AtomicLong writeErrorCounter = new AtomicLong(0);
    private final Timer writeTimer;

    public JpaAccountStore(AccountJpaRepository jpaRepository, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.jpaRepository = jpaRepository;
        this.objectMapper = objectMapper;

        meterRegistry.gauge("account.store.writes.total", writeCounter);
        meterRegistry.gauge("account.store.write.errors", writeErrorCounter);
        this.writeTimer = meterRegistry.timer("account.store.write.latency");
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Account> loadAll() {
        Map<String, Account> accounts = new LinkedHashMap<>();
        for (AccountEntity entity : jpaRepository.findAll()) {
            try {
                accounts.put(entity.getUserId(), fromEntity(entity));
            } catch (JsonProcessingException e) {
                // One corrupt row must not block the others from loading
                log.error("Skipping unreadable account row: user={}", entity.getUserId(), e);
            }
        }
        log.info("Loaded {} accounts from database", accounts.size());
        return accounts;
    }

    @Override
    @Transactional
    public void save(String userId, Account account) {
        writeTimer.record(() -> {
            try {
                AccountEntity entity = jpaRepository.findById(userId)
                    .orElseGet(() -> AccountEntity.builder().userId(userId).build());
                entity.setUsername(account.getUsername());
                entity.setAssetBalances(objectMapper.writeValueAsString(account.getBalances()));
                entity.setTradeHistory(objectMapper.writeValueAsString(account.getHistory()));
                jpaRepository.save(entity);
                writeCounter.incrementAndGet();

                if (log.isTraceEnabled()) {
                    log.trace("Persisted account: user={}, transactions={}", userId, account.getHistory().size());
                }
            } catch (Exception e) {
                writeErrorCounter.incrementAndGet();
                throw new AccountStoreException("Failed to save account " + userId, e);
            }
        });
    }

    @Override
    @Transactional
    public void delete(String userId) {
        if (jpaRepository.existsById(userId)) {
            jpaRepository.deleteById(userId);
            log.info("Deleted persisted account: user={}", userId);
        }
    }

    @Override
    public long count() {
        return jpaRepository.count();
    }

    @Override
    public boolean isHealthy() {
        try {
            jpaRepository.count();
            return true;
        } catch (Exception e) {
            log.error("Account store health check failed", e);
            return false;
        }
    }

    private Account fromEntity(AccountEntity entity) throws JsonProcessingException {
        Map<String, Double> balances = objectMapper.readValue(entity.getAssetBalances(), BALANCES);
        List<Transaction> history = objectMapper.readValue(entity.getTradeHistory(), HISTORY);
        return new Account(entity.getUsername(), balances, history);
    }

    /**
     * Storage failure wrapping JPA and serialization errors.
     */
    public static class AccountStoreException extends RuntimeException {
        public AccountStoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
