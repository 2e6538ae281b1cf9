package com.example.ledger_manager.mapper;

import com.example.ledger_manager.entity.MovementKind;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Setter
public class MovementParams {
    private Long accountId;
    private MovementKind kind;
    private BigDecimal amount;
    private String transferReference;
    private LocalDateTime movementDt;
}
