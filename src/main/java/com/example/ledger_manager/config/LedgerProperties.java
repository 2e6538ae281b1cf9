package com.example.ledger_manager.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
@ConfigurationProperties(prefix = "ledger")
@Data
public class LedgerProperties {

    private Limits limits = new Limits();

    private Console console = new Console();

    @Data
    public static class Limits {

        /**
         * Largest amount accepted by a single deposit, withdrawal or transfer.
         */
        private BigDecimal maxAmount = new BigDecimal("1000000000.00");
    }

    @Data
    public static class Console {

        /**
         * Run the interactive menu on start-up. Disabled in tests.
         */
        private boolean enabled = true;
    }
}
