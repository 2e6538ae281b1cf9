package com.example.ledger_manager.console;

import com.example.ledger_manager.dto.AccountSnapshot;
import com.example.ledger_manager.dto.response.LedgerError;
import com.example.ledger_manager.dto.response.OperationResult;
import com.example.ledger_manager.service.AccountRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerConsoleTest {

    @Mock private CommandDispatcher dispatcher;
    @Mock private AccountRegistry accountRegistry;

    @InjectMocks
    private LedgerConsole console;

    private final AccountSnapshot alice = new AccountSnapshot(1L, "Alice", new BigDecimal("50.00"), null);

    @Test
    void exit_printsMenuOnce() throws IOException {
        String output = run("6\n");

        assertThat(output).contains("1. Create Account", "5. Client Actions", "6. Exit", "Select an option: ");
        verifyNoInteractions(dispatcher, accountRegistry);
    }

    @Test
    void endOfInput_endsTheLoop() throws IOException {
        run("");

        verifyNoInteractions(dispatcher);
    }

    @Test
    void unknownOrNonNumericOption_invalidAction() throws IOException {
        String output = run("9\nabc\n6\n");

        assertThat(output.split("Invalid action\\.", -1)).hasSize(3);
        verifyNoInteractions(dispatcher);
    }

    @Test
    void createAccount_blankOccupationSentAsAbsent() throws IOException {
        when(dispatcher.dispatch(any())).thenReturn("Created account 1 for Alice.");

        String output = run("1\n Alice \n\n6\n");

        verify(dispatcher).dispatch(new ConsoleCommand.CreateAccount("Alice", null));
        assertThat(output).contains("Enter first name: ", "Enter occupation (optional): ", "Created account 1 for Alice.");
    }

    @Test
    void closeAccount_nonNumericId_reportedWithoutDispatch() throws IOException {
        String output = run("2\nx1\n6\n");

        assertThat(output).contains("Invalid client ID: x1");
        verifyNoInteractions(dispatcher);
    }

    @Test
    void countClients_printsDispatcherAnswer() throws IOException {
        when(dispatcher.dispatch(new ConsoleCommand.CountClients())).thenReturn("Total clients: 0");

        assertThat(run("4\n6\n")).contains("Total clients: 0");
    }

    @Test
    void clientActions_unknownClient() throws IOException {
        when(accountRegistry.findAccount(42L))
                .thenReturn(OperationResult.failure(LedgerError.NOT_FOUND, "Account not found: 42"));

        String output = run("5\n42\n6\n");

        assertThat(output).contains("Client not found.");
        assertThat(output).doesNotContain("1. Withdraw");
    }

    @Test
    void clientActions_withdrawThenBackToBankMenu() throws IOException {
        when(accountRegistry.findAccount(1L)).thenReturn(OperationResult.success(alice));
        when(dispatcher.dispatch(any())).thenReturn("Withdrawn 30.00 from client ID 1. New balance: 20.00");

        String output = run("5\n1\n1\n30\n6\n6\n");

        verify(dispatcher).dispatch(new ConsoleCommand.Withdraw(alice, new BigDecimal("30")));
        assertThat(output).contains("1. Withdraw", "5. Show Movements", "Enter amount to withdraw: ",
                "New balance: 20.00");
    }

    @Test
    void clientActions_nanAmount_rejectedAtParseTime() throws IOException {
        when(accountRegistry.findAccount(1L)).thenReturn(OperationResult.success(alice));

        String output = run("5\n1\n2\nNaN\n6\n6\n");

        assertThat(output).contains("Invalid amount: NaN");
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void clientActions_transferCollectsDestinationAndAmount() throws IOException {
        when(accountRegistry.findAccount(1L)).thenReturn(OperationResult.success(alice));
        when(dispatcher.dispatch(any())).thenReturn("Transferred 20.00 from client ID 1 to client ID 2. New balance: 30.00");

        String output = run("5\n1\n3\n2\n20\n6\n6\n");

        verify(dispatcher).dispatch(new ConsoleCommand.Transfer(alice, 2L, new BigDecimal("20")));
        assertThat(output).contains("Enter client ID to transfer to: ", "Enter amount to transfer: ");
    }

    @Test
    void clientActions_endOfInputInsideClientMenu() throws IOException {
        when(accountRegistry.findAccount(1L)).thenReturn(OperationResult.success(alice));

        run("5\n1\n4\n");

        verify(dispatcher).dispatch(new ConsoleCommand.CheckBalance(alice));
    }

    @Test
    void clientActions_endOfInputAtAmountPrompt_endsWithoutDispatch() throws IOException {
        when(accountRegistry.findAccount(1L)).thenReturn(OperationResult.success(alice));

        String output = run("5\n1\n2\n");

        assertThat(output).endsWith("Enter amount to deposit: ");
        assertThat(output).doesNotContain("Invalid amount");
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void parseAmount_rejectsInfinity() {
        assertThat(LedgerConsole.parseAmount("Infinity")).isEmpty();
        assertThat(LedgerConsole.parseAmount(" 12.50 ")).contains(new BigDecimal("12.50"));
    }

    private String run(String input) throws IOException {
        var bytes = new ByteArrayOutputStream();
        try (var out = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
            console.run(new BufferedReader(new StringReader(input)), out);
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }
}
