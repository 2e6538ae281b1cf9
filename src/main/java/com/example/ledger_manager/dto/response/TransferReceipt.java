package com.example.ledger_manager.dto.response;

import com.example.ledger_manager.dto.AccountSnapshot;

import java.math.BigDecimal;

public record TransferReceipt(
        String transferReference,
        AccountSnapshot source,
        AccountSnapshot destination,
        BigDecimal amount
) {}
