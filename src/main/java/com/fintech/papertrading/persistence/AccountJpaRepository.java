package com.fintech.papertrading.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Spring Data JPA repository for persisted accounts.
 */
@Repository
public interface AccountJpaRepository extends JpaRepository<AccountEntity, String> {
}
