package com.fintech.papertrading.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.Length;

/**
 * JPA entity for a persisted account.
 * Balances and transaction history are stored as JSON documents.
 */
@Entity
@Table(name = "accounts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountEntity {

    @Id
    @Column(name = "user_id", length = 100)
    private String userId;

    @Column(nullable = false, length = 100)
    private String username;

    /**
     * JSON object: asset symbol -> balance
     */
    @Column(name = "asset_balances", nullable = false, length = Length.LONG32)
    private String assetBalances;

    /**
     * JSON array of transactions in insertion order
     */
    @Column(name = "trade_history", nullable = false, length = Length.LONG32)
    private String tradeHistory;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Long createdAt;

    @Column(name = "updated_at", nullable = false)
    private Long updatedAt;

    @PrePersist
    protected void onCreate() {
        long now = System.currentTimeMillis();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = System.currentTimeMillis();
    }
}
