package com.example.ledger_manager;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LedgerManagerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerManagerApplication.class, args);
    }
}
