package com.example.ledger_manager.dto.response;

/**
 * Expected, user-facing outcomes of a rejected ledger operation. None of them
 * leaves any trace in storage.
 */
public enum LedgerError {
    NOT_FOUND,
    DESTINATION_NOT_FOUND,
    INSUFFICIENT_FUNDS,
    INVALID_AMOUNT,
    INVALID_INPUT
}
