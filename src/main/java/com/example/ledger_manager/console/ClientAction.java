package com.example.ledger_manager.console;

import java.util.Arrays;
import java.util.Optional;

public enum ClientAction {
    WITHDRAW(1, "Withdraw"),
    DEPOSIT(2, "Deposit"),
    TRANSFER(3, "Transfer"),
    CHECK_BALANCE(4, "Check Balance"),
    SHOW_MOVEMENTS(5, "Show Movements"),
    EXIT(6, "Exit");

    private final int option;
    private final String label;

    ClientAction(int option, String label) {
        this.option = option;
        this.label = label;
    }

    public int getOption() {
        return option;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<ClientAction> fromOption(int option) {
        return Arrays.stream(values())
                .filter(action -> action.option == option)
                .findFirst();
    }
}
