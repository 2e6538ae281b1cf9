package com.example.ledger_manager.console;

import com.example.ledger_manager.advice.GlobalExceptionHandler;
import com.example.ledger_manager.dto.AccountSnapshot;
import com.example.ledger_manager.dto.MovementView;
import com.example.ledger_manager.dto.response.OperationResult;
import com.example.ledger_manager.exception.LedgerStorageException;
import com.example.ledger_manager.service.AccountRegistry;
import com.example.ledger_manager.service.TransactionService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Validates a {@link ConsoleCommand}, runs it against the registry or the engine,
 * and renders the outcome as console text.
 */
@Slf4j
@Component
public class CommandDispatcher {

    private final AccountRegistry accountRegistry;
    private final TransactionService transactionService;
    private final Validator validator;
    private final GlobalExceptionHandler exceptionHandler;

    public CommandDispatcher(AccountRegistry accountRegistry,
                             TransactionService transactionService,
                             Validator validator,
                             GlobalExceptionHandler exceptionHandler) {
        this.accountRegistry = accountRegistry;
        this.transactionService = transactionService;
        this.validator = validator;
        this.exceptionHandler = exceptionHandler;
    }

    public String dispatch(ConsoleCommand command) {
        Set<ConstraintViolation<ConsoleCommand>> violations = validator.validate(command);
        if (!violations.isEmpty()) {
            return exceptionHandler.handleValidationErrors(violations).entrySet().stream()
                    .map(entry -> entry.getKey() + ": " + entry.getValue())
                    .collect(Collectors.joining(System.lineSeparator()));
        }

        log.debug("Dispatching {}", command.getClass().getSimpleName());
        try {
            return execute(command);
        } catch (LedgerStorageException e) {
            return exceptionHandler.handleStorageFailure(e);
        } catch (RuntimeException e) {
            return exceptionHandler.handleGeneric(e);
        }
    }

    private String execute(ConsoleCommand command) {
        if (command instanceof ConsoleCommand.CreateAccount create) {
            return render(accountRegistry.openAccount(create.firstName(), create.occupation()),
                    account -> "Created account " + account.id() + " for " + account.name()
                            + (account.occupation() == null ? "" : " with occupation " + account.occupation()) + ".");
        }
        if (command instanceof ConsoleCommand.CloseAccount close) {
            return render(accountRegistry.closeAccount(close.accountId()),
                    account -> "Closed account with client ID " + account.id() + ".");
        }
        if (command instanceof ConsoleCommand.ShowAllClients) {
            List<AccountSnapshot> accounts = accountRegistry.listAccounts();
            if (accounts.isEmpty()) {
                return "No clients.";
            }
            return accounts.stream()
                    .map(CommandDispatcher::formatAccount)
                    .collect(Collectors.joining(System.lineSeparator()));
        }
        if (command instanceof ConsoleCommand.CountClients) {
            return "Total clients: " + accountRegistry.countAccounts();
        }
        if (command instanceof ConsoleCommand.Withdraw withdraw) {
            return render(transactionService.withdraw(withdraw.account(), withdraw.amount()),
                    account -> "Withdrawn " + money(withdraw.amount()) + " from client ID " + account.id()
                            + ". New balance: " + money(account.balance()));
        }
        if (command instanceof ConsoleCommand.Deposit deposit) {
            return render(transactionService.deposit(deposit.account(), deposit.amount()),
                    account -> "Deposited " + money(deposit.amount()) + " to client ID " + account.id()
                            + ". New balance: " + money(account.balance()));
        }
        if (command instanceof ConsoleCommand.Transfer transfer) {
            return render(transactionService.transfer(transfer.source(), transfer.destinationId(), transfer.amount()),
                    receipt -> "Transferred " + money(receipt.amount()) + " from client ID " + receipt.source().id()
                            + " to client ID " + receipt.destination().id()
                            + ". New balance: " + money(receipt.source().balance()));
        }
        if (command instanceof ConsoleCommand.CheckBalance check) {
            return render(transactionService.checkBalance(check.account()),
                    balance -> "Client ID " + check.account().id() + " balance: " + money(balance));
        }
        if (command instanceof ConsoleCommand.ShowMovements show) {
            return render(transactionService.showMovements(show.account()),
                    movements -> formatMovements(show.account().id(), movements));
        }
        throw new IllegalArgumentException("Unsupported command: " + command.getClass().getSimpleName());
    }

    private <T> String render(OperationResult<T> result, Function<T, String> onSuccess) {
        if (!result.isSuccess()) {
            return exceptionHandler.handleLedgerError(result.error(), result.message());
        }
        return onSuccess.apply(result.value());
    }

    private static String formatAccount(AccountSnapshot account) {
        return String.format(Locale.US, "%d | %s | %s | %s",
                account.id(),
                account.name(),
                money(account.balance()),
                account.occupation() == null ? "-" : account.occupation());
    }

    private static String formatMovements(Long accountId, List<MovementView> movements) {
        StringBuilder out = new StringBuilder("Client ID " + accountId + " movements:");
        if (movements.isEmpty()) {
            out.append(System.lineSeparator()).append("No movements.");
        }
        for (MovementView movement : movements) {
            out.append(System.lineSeparator())
                    .append(String.format(Locale.US, "%d | %s | %s%s",
                            movement.id(),
                            movement.kind(),
                            movement.amount().signum() > 0 ? "+" : "",
                            money(movement.amount())));
            if (movement.transferReference() != null) {
                out.append(" | ref ").append(movement.transferReference());
            }
        }
        return out.toString();
    }

    private static String money(BigDecimal amount) {
        return amount == null ? "-" : amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
