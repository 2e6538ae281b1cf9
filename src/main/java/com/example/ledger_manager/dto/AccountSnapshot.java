package com.example.ledger_manager.dto;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * Point-in-time copy of an account row. Holding one does not keep the account alive
 * or reflect later changes; re-read through the registry for a fresh value.
 */
@Builder
public record AccountSnapshot(
        Long id,
        String name,
        BigDecimal balance,
        String occupation
) {}
