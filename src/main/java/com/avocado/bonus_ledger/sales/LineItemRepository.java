package com.avocado.bonus_ledger.sales;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LineItemRepository extends JpaRepository<LineItemEntity, Long> {

    List<LineItemEntity> findByTransactionIdOrderByIdAsc(Long transactionId);

    Optional<LineItemEntity> findByIdAndTransactionId(Long id, Long transactionId);
}
