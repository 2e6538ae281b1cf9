package com.example.ledger_manager.console;

import java.util.Arrays;
import java.util.Optional;

public enum BankAction {
    CREATE_ACCOUNT(1, "Create Account"),
    CLOSE_ACCOUNT(2, "Close Account"),
    SHOW_ALL_CLIENTS(3, "Show All Clients"),
    COUNT_CLIENTS(4, "Count Clients"),
    CLIENT_ACTIONS(5, "Client Actions"),
    EXIT(6, "Exit");

    private final int option;
    private final String label;

    BankAction(int option, String label) {
        this.option = option;
        this.label = label;
    }

    public int getOption() {
        return option;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<BankAction> fromOption(int option) {
        return Arrays.stream(values())
                .filter(action -> action.option == option)
                .findFirst();
    }
}
