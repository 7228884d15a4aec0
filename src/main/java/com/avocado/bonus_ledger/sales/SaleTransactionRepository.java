package com.avocado.bonus_ledger.sales;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SaleTransactionRepository extends JpaRepository<SaleTransactionEntity, Long> {

    /**
     * Used by the idempotency database fallback.
     */
    Optional<SaleTransactionEntity> findByIdempotencyKey(String idempotencyKey);
}
