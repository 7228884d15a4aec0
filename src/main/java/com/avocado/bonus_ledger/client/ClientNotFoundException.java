package com.avocado.bonus_ledger.client;

public class ClientNotFoundException extends RuntimeException {

    public ClientNotFoundException(Long clientId) {
        super("Client not found: " + clientId);
    }
}
