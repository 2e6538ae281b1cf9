package com.example.ledger_manager.service;

import com.example.ledger_manager.dto.AccountSnapshot;
import com.example.ledger_manager.dto.response.OperationResult;

import java.util.List;

public interface AccountRegistry {

    OperationResult<AccountSnapshot> openAccount(String name, String occupation);

    /**
     * Deletes the account together with its movements.
     *
     * @return the account as it was just before closing
     */
    OperationResult<AccountSnapshot> closeAccount(Long id);

    OperationResult<AccountSnapshot> findAccount(Long id);

    List<AccountSnapshot> listAccounts();

    long countAccounts();
}
