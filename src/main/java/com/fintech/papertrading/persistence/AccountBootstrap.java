package com.fintech.papertrading.persistence;

import com.fintech.papertrading.config.TradingProperties;
import com.fintech.papertrading.domain.Account;
import com.fintech.papertrading.ledger.LedgerService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Populates the ledger at startup: persisted accounts plus a fresh, memory-only
 * demo account.
 */
@Component
public class AccountBootstrap {

    private static final Logger log = LoggerFactory.getLogger(AccountBootstrap.class);

    private final AccountPersistenceService persistence;
    private final LedgerService ledger;
    private final TradingProperties properties;

    public AccountBootstrap(AccountPersistenceService persistence, LedgerService ledger, TradingProperties properties) {
        this.persistence = persistence;
        this.ledger = ledger;
        this.properties = properties;
    }

    @PostConstruct
    public void initialize() {
        Map<String, Account> accounts = persistence.loadAll();
        accounts.forEach(ledger::register);

        ledger.register(properties.getDemoUserId(), Account.seeded(
            properties.getDemoUsername(), properties.getReferenceCurrency(), properties.getStartingBalance()));

        log.info("Initialized with {} persisted users + demo user", accounts.size());
    }
}
