package com.example.ledger_manager.advice;

import com.example.ledger_manager.dto.response.LedgerError;
import com.example.ledger_manager.exception.LedgerStorageException;
import jakarta.validation.ConstraintViolation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns rejected operations and failures into the text shown by the console.
 */
@Slf4j
@Component
public class GlobalExceptionHandler {

    public String handleLedgerError(LedgerError error, String message) {
        return switch (error) {
            case NOT_FOUND -> "Client not found.";
            case DESTINATION_NOT_FOUND -> "Client to transfer to not found.";
            case INSUFFICIENT_FUNDS -> "Insufficient funds." + detail(message);
            case INVALID_AMOUNT -> "Invalid amount." + detail(message);
            case INVALID_INPUT -> "Invalid input." + detail(message);
        };
    }

    public Map<String, String> handleValidationErrors(Set<? extends ConstraintViolation<?>> violations) {
        Map<String, String> errors = new TreeMap<>();
        violations.forEach(violation ->
                errors.put(violation.getPropertyPath().toString(), violation.getMessage()));
        return errors;
    }

    public String handleStorageFailure(LedgerStorageException ex) {
        log.error("Storage failure, operation rolled back", ex);
        return "Storage failure: " + ex.getMessage() + ". The operation was not applied.";
    }

    public String handleGeneric(Exception ex) {
        log.error("Unexpected error while running a console command", ex);
        return "Unexpected error: " + ex.getMessage();
    }

    private static String detail(String message) {
        return message == null || message.isBlank() ? "" : " " + message;
    }
}
