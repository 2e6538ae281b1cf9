package com.example.ledger_manager.entity;

public enum MovementKind {
    WITHDRAW,
    DEPOSIT,
    TRANSFER_OUT,
    TRANSFER_IN;

    public boolean isOutflow() {
        return this == WITHDRAW || this == TRANSFER_OUT;
    }
}
