package com.example.ledger_manager.exception;

public class LedgerStorageException extends RuntimeException {
    public LedgerStorageException(String message) {
        super(message);
    }

    public LedgerStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
