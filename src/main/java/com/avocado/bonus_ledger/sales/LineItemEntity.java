package com.avocado.bonus_ledger.sales;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * JPA entity for transaction_products, one row per product on a receipt.
 */
@Entity
@Table(name = "transaction_products")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LineItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private Long transactionId;

    @Column(name = "product_id")
    private Long productId;

    @Column(name = "product_name")
    private String productName;

    @Column(name = "quantity", nullable = false, precision = 10, scale = 3)
    private BigDecimal quantity;

    @Column(name = "price", precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "sum", nullable = false, precision = 10, scale = 2)
    private BigDecimal lineSum;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = LocalDateTime.now();
    }

    static LineItemEntity fromNewLineItem(Long transactionId, NewLineItem item) {
        if (item.getLineSum() == null) {
            throw new IllegalArgumentException("Line item sum is required");
        }
        return new LineItemEntity(
            null,
            transactionId,
            item.getProductId(),
            item.getProductName(),
            item.getQuantity() != null ? item.getQuantity() : BigDecimal.ONE,
            item.getPrice(),
            item.getLineSum(),
            null
        );
    }

    public LineItem toDomain() {
        return new LineItem(id, transactionId, productId, productName, quantity, price, lineSum, createdAt);
    }

    void changeQuantityAndSum(BigDecimal newQuantity, BigDecimal newLineSum) {
        if (newLineSum == null) {
            throw new IllegalArgumentException("Line item sum is required");
        }
        if (newQuantity != null) {
            this.quantity = newQuantity;
        }
        this.lineSum = newLineSum;
    }
}
