package com.example.ledger_manager.service;

import com.example.ledger_manager.dto.AccountSnapshot;
import com.example.ledger_manager.dto.MovementView;
import com.example.ledger_manager.dto.response.OperationResult;
import com.example.ledger_manager.dto.response.TransferReceipt;

import java.math.BigDecimal;
import java.util.List;

public interface TransactionService {

    OperationResult<AccountSnapshot> withdraw(AccountSnapshot account, BigDecimal amount);

    OperationResult<AccountSnapshot> deposit(AccountSnapshot account, BigDecimal amount);

    OperationResult<TransferReceipt> transfer(AccountSnapshot source, Long destinationId, BigDecimal amount);

    OperationResult<BigDecimal> checkBalance(AccountSnapshot account);

    OperationResult<List<MovementView>> showMovements(AccountSnapshot account);
}
