package com.avocado.bonus_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BonusLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BonusLedgerApplication.class, args);
    }
}
