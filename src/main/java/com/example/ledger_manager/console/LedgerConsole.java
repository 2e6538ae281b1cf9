package com.example.ledger_manager.console;

import com.example.ledger_manager.dto.AccountSnapshot;
import com.example.ledger_manager.dto.response.OperationResult;
import com.example.ledger_manager.service.AccountRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Text front end: the bank menu and, for a selected client, the client menu.
 * It only parses input into {@link ConsoleCommand}s and prints what the
 * {@link CommandDispatcher} answers; it holds no ledger state of its own.
 */
@Slf4j
@Component
public class LedgerConsole {

    private final CommandDispatcher dispatcher;
    private final AccountRegistry accountRegistry;

    public LedgerConsole(CommandDispatcher dispatcher, AccountRegistry accountRegistry) {
        this.dispatcher = dispatcher;
        this.accountRegistry = accountRegistry;
    }

    /**
     * Runs the bank menu until the user picks Exit or the input ends.
     */
    public void run(BufferedReader in, PrintStream out) throws IOException {
        while (true) {
            printBankMenu(out);
            Optional<String> choice = prompt(in, out, "Select an option: ");
            if (choice.isEmpty()) {
                return;
            }
            Optional<BankAction> action = parseInt(choice.get()).flatMap(BankAction::fromOption);
            if (action.isEmpty()) {
                out.println("Invalid action.");
                continue;
            }
            log.debug("Bank menu action {}", action.get());
            switch (action.get()) {
                case CREATE_ACCOUNT -> {
                    Optional<String> firstName = prompt(in, out, "Enter first name: ");
                    if (firstName.isEmpty()) {
                        return;
                    }
                    String occupation = prompt(in, out, "Enter occupation (optional): ").orElse("");
                    out.println(dispatcher.dispatch(new ConsoleCommand.CreateAccount(firstName.get().strip(),
                            occupation.isBlank() ? null : occupation.strip())));
                }
                case CLOSE_ACCOUNT -> {
                    Optional<String> id = prompt(in, out, "Enter client ID: ");
                    if (id.isEmpty()) {
                        return;
                    }
                    Optional<Long> accountId = parseLong(id.get());
                    if (accountId.isEmpty()) {
                        out.println("Invalid client ID: " + id.get());
                    } else {
                        out.println(dispatcher.dispatch(new ConsoleCommand.CloseAccount(accountId.get())));
                    }
                }
                case SHOW_ALL_CLIENTS -> out.println(dispatcher.dispatch(new ConsoleCommand.ShowAllClients()));
                case COUNT_CLIENTS -> out.println(dispatcher.dispatch(new ConsoleCommand.CountClients()));
                case CLIENT_ACTIONS -> {
                    if (!selectClient(in, out)) {
                        return;
                    }
                }
                case EXIT -> {
                    return;
                }
            }
        }
    }

    // false when the input ended
    private boolean selectClient(BufferedReader in, PrintStream out) throws IOException {
        Optional<String> id = prompt(in, out, "Enter client ID: ");
        if (id.isEmpty()) {
            return false;
        }
        Optional<Long> accountId = parseLong(id.get());
        if (accountId.isEmpty()) {
            out.println("Invalid client ID: " + id.get());
            return true;
        }
        OperationResult<AccountSnapshot> found = accountRegistry.findAccount(accountId.get());
        if (!found.isSuccess()) {
            out.println("Client not found.");
            return true;
        }
        return clientLoop(in, out, found.value());
    }

    private boolean clientLoop(BufferedReader in, PrintStream out, AccountSnapshot account) throws IOException {
        while (true) {
            printClientMenu(out);
            Optional<String> choice = prompt(in, out, "Select an action: ");
            if (choice.isEmpty()) {
                return false;
            }
            Optional<ClientAction> action = parseInt(choice.get()).flatMap(ClientAction::fromOption);
            if (action.isEmpty()) {
                out.println("Invalid action.");
                continue;
            }
            log.debug("Client menu action {} for client ID {}", action.get(), account.id());
            switch (action.get()) {
                case WITHDRAW -> {
                    Optional<String> text = prompt(in, out, "Enter amount to withdraw: ");
                    if (text.isEmpty()) {
                        return false;
                    }
                    amountOrReport(text.get(), out).ifPresent(value ->
                            out.println(dispatcher.dispatch(new ConsoleCommand.Withdraw(account, value))));
                }
                case DEPOSIT -> {
                    Optional<String> text = prompt(in, out, "Enter amount to deposit: ");
                    if (text.isEmpty()) {
                        return false;
                    }
                    amountOrReport(text.get(), out).ifPresent(value ->
                            out.println(dispatcher.dispatch(new ConsoleCommand.Deposit(account, value))));
                }
                case TRANSFER -> {
                    Optional<String> target = prompt(in, out, "Enter client ID to transfer to: ");
                    if (target.isEmpty()) {
                        return false;
                    }
                    Optional<Long> destinationId = parseLong(target.get());
                    if (destinationId.isEmpty()) {
                        out.println("Invalid client ID: " + target.get());
                        continue;
                    }
                    Optional<String> text = prompt(in, out, "Enter amount to transfer: ");
                    if (text.isEmpty()) {
                        return false;
                    }
                    amountOrReport(text.get(), out).ifPresent(value -> out.println(dispatcher.dispatch(
                            new ConsoleCommand.Transfer(account, destinationId.get(), value))));
                }
                case CHECK_BALANCE -> out.println(dispatcher.dispatch(new ConsoleCommand.CheckBalance(account)));
                case SHOW_MOVEMENTS -> out.println(dispatcher.dispatch(new ConsoleCommand.ShowMovements(account)));
                case EXIT -> {
                    return true;
                }
            }
        }
    }

    private void printBankMenu(PrintStream out) {
        for (BankAction action : BankAction.values()) {
            out.println(action.getOption() + ". " + action.getLabel());
        }
    }

    private void printClientMenu(PrintStream out) {
        for (ClientAction action : ClientAction.values()) {
            out.println(action.getOption() + ". " + action.getLabel());
        }
    }

    private Optional<String> prompt(BufferedReader in, PrintStream out, String message) throws IOException {
        out.print(message);
        out.flush();
        return Optional.ofNullable(in.readLine());
    }

    private Optional<BigDecimal> amountOrReport(String text, PrintStream out) {
        Optional<BigDecimal> amount = parseAmount(text);
        if (amount.isEmpty()) {
            out.println("Invalid amount: " + text);
        }
        return amount;
    }

    static Optional<Integer> parseInt(String text) {
        try {
            return Optional.of(Integer.parseInt(text.strip()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    static Optional<Long> parseLong(String text) {
        try {
            return Optional.of(Long.parseLong(text.strip()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    // BigDecimal has no NaN or Infinity, so those inputs are rejected here
    static Optional<BigDecimal> parseAmount(String text) {
        try {
            return Optional.of(new BigDecimal(text.strip()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
