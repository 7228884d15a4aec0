package com.avocado.bonus_ledger.sales;

import com.avocado.bonus_ledger.client.ClientNotFoundException;
import com.avocado.bonus_ledger.client.ClientService;
import com.avocado.bonus_ledger.observability.BonusMetrics;
import com.avocado.bonus_ledger.sales.event.LineItemsChangedEvent;
import com.avocado.bonus_ledger.sales.event.PaymentChangedEvent;
import com.avocado.bonus_ledger.sales.event.SaleWrittenEvent;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Write path for sales and their line items.
 *
 * Every write is flushed and then announced with an application event inside the same
 * transaction. The bonus and discount engines listen synchronously, so their effects
 * commit or roll back together with the write that caused them. Returned snapshots are
 * re-read after the listeners ran and include the reconciled discount.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SalesService {

    private final SaleTransactionRepository saleRepository;
    private final LineItemRepository lineItemRepository;
    private final ClientService clientService;
    private final ApplicationEventPublisher eventPublisher;
    private final EntityManager entityManager;
    private final BonusMetrics metrics;

    /**
     * Records a new sale together with its line items.
     *
     * @param idempotencyKey optional request key, stored with the sale
     * @param source where the sale came from, for metrics (api, pos_sync)
     * @throws IllegalStateException if the transaction id is already recorded
     * @throws ClientNotFoundException if the sale references an unknown client
     */
    @Transactional
    public SaleTransaction recordSale(NewSale sale, String idempotencyKey, String source) {
        validate(sale);
        Long transactionId = sale.getTransactionId();

        if (saleRepository.existsById(transactionId)) {
            throw new IllegalStateException("Transaction already recorded: " + transactionId);
        }
        if (sale.getClientId() != null && !clientService.exists(sale.getClientId())) {
            throw new ClientNotFoundException(sale.getClientId());
        }

        SaleTransactionEntity entity = saleRepository.saveAndFlush(
            SaleTransactionEntity.fromNewSale(sale, idempotencyKey));
        eventPublisher.publishEvent(SaleWrittenEvent.inserted(entity.toDomain()));

        if (!sale.getLineItems().isEmpty()) {
            for (NewLineItem item : sale.getLineItems()) {
                lineItemRepository.save(LineItemEntity.fromNewLineItem(transactionId, item));
            }
            lineItemRepository.flush();
            eventPublisher.publishEvent(new LineItemsChangedEvent(transactionId));
        }

        metrics.recordSaleRecorded(source);
        log.info("Recorded sale {}: client={}, sum={}, items={}, source={}",
            transactionId, sale.getClientId(), sale.getTotalSum(), sale.getLineItems().size(), source);

        return reload(entity);
    }

    /**
     * Replaces the paid amounts of a sale. The discount follows only if an amount actually
     * changed; bonus is never posted again for an existing sale.
     */
    @Transactional
    public SaleTransaction updatePayment(Long transactionId, BigDecimal paidSum, BigDecimal paidBonus) {
        requireNonNegative(paidSum, "paid_sum");
        requireNonNegative(paidBonus, "paid_bonus");

        SaleTransactionEntity entity = saleRepository.findById(transactionId)
            .orElseThrow(() -> new SaleNotFoundException(transactionId));

        BigDecimal previousPaidSum = entity.getPaidSum();
        BigDecimal previousPaidBonus = entity.getPaidBonus();
        boolean changed = entity.applyPayment(paidSum, paidBonus);

        saleRepository.saveAndFlush(entity);
        eventPublisher.publishEvent(SaleWrittenEvent.updated(entity.toDomain()));
        if (changed) {
            eventPublisher.publishEvent(new PaymentChangedEvent(
                transactionId, previousPaidSum, previousPaidBonus, paidSum, paidBonus));
            log.info("Payment of sale {} changed: paid_sum {} -> {}, paid_bonus {} -> {}",
                transactionId, previousPaidSum, paidSum, previousPaidBonus, paidBonus);
        }

        return reload(entity);
    }

    @Transactional
    public LineItem addLineItem(Long transactionId, NewLineItem item) {
        requireSale(transactionId);
        requireNonNegative(item.getLineSum(), "sum");

        LineItemEntity saved = lineItemRepository.saveAndFlush(LineItemEntity.fromNewLineItem(transactionId, item));
        eventPublisher.publishEvent(new LineItemsChangedEvent(transactionId));

        log.debug("Added line item {} to sale {}", saved.getId(), transactionId);
        return saved.toDomain();
    }

    @Transactional
    public LineItem updateLineItem(Long transactionId, Long lineItemId, BigDecimal quantity, BigDecimal lineSum) {
        requireNonNegative(lineSum, "sum");
        LineItemEntity entity = findLineItem(transactionId, lineItemId);

        entity.changeQuantityAndSum(quantity, lineSum);
        lineItemRepository.saveAndFlush(entity);
        eventPublisher.publishEvent(new LineItemsChangedEvent(transactionId));

        return entity.toDomain();
    }

    @Transactional
    public void removeLineItem(Long transactionId, Long lineItemId) {
        LineItemEntity entity = findLineItem(transactionId, lineItemId);

        lineItemRepository.delete(entity);
        lineItemRepository.flush();
        eventPublisher.publishEvent(new LineItemsChangedEvent(transactionId));

        log.debug("Removed line item {} from sale {}", lineItemId, transactionId);
    }

    /**
     * Applies a sale from the POS feed. A sale seen for the first time is recorded;
     * a known one only has its paid amounts refreshed.
     */
    @Transactional
    public SaleTransaction syncSale(NewSale sale, String source) {
        validate(sale);
        if (saleRepository.existsById(sale.getTransactionId())) {
            return updatePayment(sale.getTransactionId(), sale.getPaidSum(), sale.getPaidBonus());
        }
        return recordSale(sale, null, source);
    }

    @Transactional(readOnly = true)
    public Optional<SaleTransaction> findSale(Long transactionId) {
        return saleRepository.findById(transactionId).map(SaleTransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<SaleTransaction> findByIdempotencyKey(String idempotencyKey) {
        return saleRepository.findByIdempotencyKey(idempotencyKey).map(SaleTransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<LineItem> getLineItems(Long transactionId) {
        requireSale(transactionId);
        return lineItemRepository.findByTransactionIdOrderByIdAsc(transactionId)
            .stream()
            .map(LineItemEntity::toDomain)
            .toList();
    }

    private SaleTransaction reload(SaleTransactionEntity entity) {
        // listeners write discount with plain SQL
        entityManager.refresh(entity);
        return entity.toDomain();
    }

    private void requireSale(Long transactionId) {
        if (!saleRepository.existsById(transactionId)) {
            throw new SaleNotFoundException(transactionId);
        }
    }

    private LineItemEntity findLineItem(Long transactionId, Long lineItemId) {
        requireSale(transactionId);
        return lineItemRepository.findByIdAndTransactionId(lineItemId, transactionId)
            .orElseThrow(() -> new IllegalArgumentException(
                "Line item " + lineItemId + " does not belong to transaction " + transactionId));
    }

    private static void validate(NewSale sale) {
        if (sale.getTransactionId() == null) {
            throw new IllegalArgumentException("Transaction ID cannot be null");
        }
        if (sale.getTotalSum() == null) {
            throw new IllegalArgumentException("Transaction sum cannot be null");
        }
        requireNonNegative(sale.getTotalSum(), "sum");
        requireNonNegative(sale.getPaidSum(), "paid_sum");
        requireNonNegative(sale.getPaidBonus(), "paid_bonus");
        requireNonNegative(sale.getBonusPercent(), "bonus_percent");
        for (NewLineItem item : sale.getLineItems()) {
            requireNonNegative(item.getLineSum(), "sum");
        }
    }

    private static void requireNonNegative(BigDecimal value, String field) {
        if (value != null && value.signum() < 0) {
            throw new IllegalArgumentException(field + " must not be negative: " + value);
        }
    }
}
