package com.avocado.bonus_ledger.consumer;

import com.avocado.bonus_ledger.client.ClientService;
import com.avocado.bonus_ledger.observability.CorrelationContext;
import com.avocado.bonus_ledger.sales.SaleTransaction;
import com.avocado.bonus_ledger.sales.SalesService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Applies synced POS sales. Runs inside the idempotent processing transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PosSaleHandler {

    static final String SOURCE = "pos_sync";

    private final ClientService clientService;
    private final SalesService salesService;

    public SaleTransaction onSale(PosSaleMessage message) {
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(message.getTransactionId()));
        try {
            if (message.getClientId() != null && !clientService.exists(message.getClientId())) {
                clientService.registerClient(message.getClientId(), message.getClientFirstname(),
                    message.getClientLastname(), message.getClientPhone());
                log.info("Registered client {} from POS sync", message.getClientId());
            }

            SaleTransaction sale = salesService.syncSale(message.toNewSale(), SOURCE);
            log.info("Synced POS sale {}: client={}, sum={}, discount={}",
                sale.getTransactionId(), sale.getClientId(), sale.getTotalSum(), sale.getDiscount());
            return sale;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }
}
