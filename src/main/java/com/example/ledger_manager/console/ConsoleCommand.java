package com.example.ledger_manager.console;

import com.example.ledger_manager.dto.AccountSnapshot;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * One request collected by the console, already parsed into typed values.
 * {@link CommandDispatcher} validates and executes it.
 */
public interface ConsoleCommand {

    record CreateAccount(
            @NotBlank(message = "First name is required")
            @Size(max = 100, message = "First name cannot exceed 100 characters")
            String firstName,

            @Size(max = 100, message = "Occupation cannot exceed 100 characters")
            String occupation
    ) implements ConsoleCommand {}

    record CloseAccount(
            @NotNull(message = "Client ID is required")
            @Positive(message = "Client ID must be positive")
            Long accountId
    ) implements ConsoleCommand {}

    record ShowAllClients() implements ConsoleCommand {}

    record CountClients() implements ConsoleCommand {}

    record Withdraw(
            @NotNull AccountSnapshot account,
            @NotNull(message = "Amount is required")
            @Positive(message = "Amount must be greater than zero")
            BigDecimal amount
    ) implements ConsoleCommand {}

    record Deposit(
            @NotNull AccountSnapshot account,
            @NotNull(message = "Amount is required")
            @Positive(message = "Amount must be greater than zero")
            BigDecimal amount
    ) implements ConsoleCommand {}

    record Transfer(
            @NotNull AccountSnapshot source,
            @NotNull(message = "Destination client ID is required")
            @Positive(message = "Destination client ID must be positive")
            Long destinationId,
            @NotNull(message = "Amount is required")
            @Positive(message = "Amount must be greater than zero")
            BigDecimal amount
    ) implements ConsoleCommand {}

    record CheckBalance(@NotNull AccountSnapshot account) implements ConsoleCommand {}

    record ShowMovements(@NotNull AccountSnapshot account) implements ConsoleCommand {}
}
