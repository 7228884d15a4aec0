package com.avocado.bonus_ledger.sales;

import com.avocado.bonus_ledger.observability.BonusMetrics;
import com.avocado.bonus_ledger.observability.CorrelationContext;
import com.avocado.bonus_ledger.sales.dto.LineItemRequest;
import com.avocado.bonus_ledger.sales.dto.LineItemResponse;
import com.avocado.bonus_ledger.sales.dto.RecordSaleRequest;
import com.avocado.bonus_ledger.sales.dto.SaleResponse;
import com.avocado.bonus_ledger.sales.dto.UpdateLineItemRequest;
import com.avocado.bonus_ledger.sales.dto.UpdatePaymentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * Sales ingestion API used by the point of sale.
 *
 * Recording a sale requires an Idempotency-Key header; repeating a request with the
 * same key returns the sale recorded the first time.
 */
@RestController
@RequestMapping("/api/sales")
@RequiredArgsConstructor
@Slf4j
public class SaleController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final String SOURCE = "api";

    private final SalesService salesService;
    private final IdempotencyService idempotencyService;
    private final BonusMetrics metrics;

    @PostMapping
    @Transactional
    public ResponseEntity<SaleResponse> recordSale(
            @Valid @RequestBody RecordSaleRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(request.getTransactionId()));

        log.info("Received sale: idempotencyKey={}, transactionId={}, clientId={}, sum={}",
                idempotencyKey, request.getTransactionId(), request.getClientId(), request.getSum());

        try {
            Optional<SaleTransaction> existing = findRecordedSale(idempotencyKey);
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotency key already used, returning transaction {}", existing.get().getTransactionId());
                return ResponseEntity.ok(SaleResponse.from(existing.get()));
            }
            metrics.recordIdempotencyMiss();

            SaleTransaction recorded = salesService.recordSale(request.toNewSale(), idempotencyKey, SOURCE);
            idempotencyService.storeIdempotencyKey(idempotencyKey, recorded.getTransactionId());

            log.info("Sale {} recorded in {}ms", recorded.getTransactionId(), System.currentTimeMillis() - startTime);
            return ResponseEntity.status(HttpStatus.CREATED).body(SaleResponse.from(recorded));

        } catch (RuntimeException e) {
            log.error("Recording sale {} failed: error={}, duration={}ms",
                    request.getTransactionId(), e.getMessage(), System.currentTimeMillis() - startTime);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private Optional<SaleTransaction> findRecordedSale(String idempotencyKey) {
        Optional<Long> transactionId = idempotencyService.checkIdempotencyKey(idempotencyKey);
        if (transactionId.isEmpty()) {
            return Optional.empty();
        }
        Optional<SaleTransaction> sale = salesService.findSale(transactionId.get());
        if (sale.isPresent()) {
            return sale;
        }

        // Cached entry outlived its sale; the database copy of the key is authoritative
        log.warn("Idempotency key {} points to missing transaction {}, dropping cached entry",
            idempotencyKey, transactionId.get());
        idempotencyService.evictIdempotencyKey(idempotencyKey);
        return idempotencyService.checkIdempotencyKey(idempotencyKey).flatMap(salesService::findSale);
    }

    @GetMapping("/{id}")
    public ResponseEntity<SaleResponse> getSale(@PathVariable("id") Long id) {
        return salesService.findSale(id)
            .map(sale -> ResponseEntity.ok(SaleResponse.from(sale)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}/payment")
    public SaleResponse updatePayment(@PathVariable("id") Long id,
                                      @Valid @RequestBody UpdatePaymentRequest request) {
        return SaleResponse.from(salesService.updatePayment(id, request.getPaidSum(), request.getPaidBonus()));
    }

    @GetMapping("/{id}/line-items")
    public List<LineItemResponse> getLineItems(@PathVariable("id") Long id) {
        return salesService.getLineItems(id).stream()
            .map(LineItemResponse::from)
            .toList();
    }

    @PostMapping("/{id}/line-items")
    public ResponseEntity<LineItemResponse> addLineItem(@PathVariable("id") Long id,
                                                        @Valid @RequestBody LineItemRequest request) {
        LineItem added = salesService.addLineItem(id, request.toNewLineItem());
        return ResponseEntity.status(HttpStatus.CREATED).body(LineItemResponse.from(added));
    }

    @PutMapping("/{id}/line-items/{itemId}")
    public LineItemResponse updateLineItem(@PathVariable("id") Long id,
                                           @PathVariable("itemId") Long itemId,
                                           @Valid @RequestBody UpdateLineItemRequest request) {
        return LineItemResponse.from(
            salesService.updateLineItem(id, itemId, request.getQuantity(), request.getSum()));
    }

    @DeleteMapping("/{id}/line-items/{itemId}")
    public ResponseEntity<Void> removeLineItem(@PathVariable("id") Long id,
                                               @PathVariable("itemId") Long itemId) {
        salesService.removeLineItem(id, itemId);
        return ResponseEntity.noContent().build();
    }
}
