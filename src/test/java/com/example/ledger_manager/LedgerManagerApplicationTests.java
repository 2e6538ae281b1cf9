package com.example.ledger_manager;

import com.example.ledger_manager.console.ConsoleRunner;
import com.example.ledger_manager.console.LedgerConsole;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class LedgerManagerApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertThat(context.getBean(LedgerConsole.class)).isNotNull();
    }

    @Test
    void consoleRunner_disabledInTests() {
        assertThat(context.getBeansOfType(ConsoleRunner.class)).isEmpty();
    }
}
