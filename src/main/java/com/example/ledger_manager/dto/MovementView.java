package com.example.ledger_manager.dto;

import com.example.ledger_manager.entity.MovementKind;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Builder
public record MovementView(
        Long id,
        Long accountId,
        MovementKind kind,
        BigDecimal amount,
        String transferReference,
        LocalDateTime movementDt
) {}
