package com.fintech.papertrading.api;

import com.fintech.papertrading.persistence.AccountStore;
import com.fintech.papertrading.state.TradingState;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for monitoring the durable account mirror against the in-memory ledger.
 */
@RestController
@RequestMapping("/api/v1/storage")
@Tag(name = "Storage", description = "Account store health")
public class StorageStatusController {

    private final AccountStore accountStore;
    private final TradingState state;

    public StorageStatusController(AccountStore accountStore, TradingState state) {
        this.accountStore = accountStore;
        this.state = state;
    }

    /**
     * Example response:
     * {
     *   "healthy": true,
     *   "persistedAccounts": 42,
     *   "inMemoryAccounts": 43,
     *   "activeBots": 3
     * }
     *
     * The demo account is never persisted, so in-memory is normally one ahead.
     */
    @Operation(summary = "Get account store health and counts")
    @GetMapping("/status")
    public ResponseEntity<StorageStatusResponse> getStatus() {
        boolean healthy = accountStore.isHealthy();
        long persisted = healthy ? accountStore.count() : -1;
        StorageStatusResponse response = state.read(s -> new StorageStatusResponse(
            healthy,
            persisted,
            s.accounts().size(),
            s.activeBots().size()
        ));
        return ResponseEntity.ok(response);
    }

    public record StorageStatusResponse(
        boolean healthy,
        long persistedAccounts,
        int inMemoryAccounts,
        int activeBots
    ) {}
}
