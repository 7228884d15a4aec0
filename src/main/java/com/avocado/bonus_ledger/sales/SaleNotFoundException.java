package com.avocado.bonus_ledger.sales;

public class SaleNotFoundException extends RuntimeException {

    public SaleNotFoundException(Long transactionId) {
        super("Transaction not found: " + transactionId);
    }
}
