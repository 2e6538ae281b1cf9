package com.example.ledger_manager.console;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "ledger.console", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ConsoleRunner implements CommandLineRunner {

    private final LedgerConsole ledgerConsole;

    public ConsoleRunner(LedgerConsole ledgerConsole) {
        this.ledgerConsole = ledgerConsole;
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("Starting ledger console");
        // System.in stays open: the JVM owns it
        var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        ledgerConsole.run(in, System.out);
        log.info("Ledger console finished");
    }
}
