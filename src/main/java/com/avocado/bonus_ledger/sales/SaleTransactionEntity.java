package com.avocado.bonus_ledger.sales;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * JPA entity for the transactions table.
 *
 * The discount column belongs to the discount reconciliation engine, which writes it
 * with plain SQL; it is read-only here so a JPA flush can never overwrite it.
 * Identity fields are not updatable: a sale is corrected through its payment fields
 * and line items only.
 */
@Entity
@Table(name = "transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SaleTransactionEntity {

    @Id
    @Column(name = "transaction_id", nullable = false, updatable = false)
    private Long transactionId;

    @Column(name = "client_id", updatable = false)
    private Long clientId;

    @Column(name = "date_close", updatable = false)
    private LocalDateTime dateClose;

    @Column(name = "sum", nullable = false, precision = 10, scale = 2, updatable = false)
    private BigDecimal totalSum;

    @Column(name = "paid_sum", precision = 10, scale = 2)
    private BigDecimal paidSum;

    @Column(name = "paid_bonus", precision = 10, scale = 2)
    private BigDecimal paidBonus;

    @Column(name = "bonus_percent", precision = 5, scale = 2, updatable = false)
    private BigDecimal bonusPercent;

    @Column(name = "discount", precision = 10, scale = 2, insertable = false, updatable = false)
    private BigDecimal discount;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    static SaleTransactionEntity fromNewSale(NewSale sale, String idempotencyKey) {
        return new SaleTransactionEntity(
            sale.getTransactionId(),
            sale.getClientId(),
            sale.getDateClose(),
            sale.getTotalSum(),
            sale.getPaidSum(),
            sale.getPaidBonus(),
            sale.getBonusPercent(),
            null, // discount - computed by the discount engine
            idempotencyKey,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public SaleTransaction toDomain() {
        return new SaleTransaction(
            transactionId,
            clientId,
            dateClose,
            totalSum,
            paidSum,
            paidBonus,
            bonusPercent,
            discount != null ? discount : BigDecimal.ZERO,
            createdAt,
            updatedAt
        );
    }

    /**
     * Applies new paid amounts.
     *
     * @return true if either amount actually changed; nulls compare equal only to nulls
     */
    boolean applyPayment(BigDecimal newPaidSum, BigDecimal newPaidBonus) {
        boolean changed = isDistinct(paidSum, newPaidSum) || isDistinct(paidBonus, newPaidBonus);
        this.paidSum = newPaidSum;
        this.paidBonus = newPaidBonus;
        return changed;
    }

    private static boolean isDistinct(BigDecimal current, BigDecimal candidate) {
        if (current == null || candidate == null) {
            return current != candidate;
        }
        return current.compareTo(candidate) != 0;
    }
}
