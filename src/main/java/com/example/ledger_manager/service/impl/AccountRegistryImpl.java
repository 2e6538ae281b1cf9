package com.example.ledger_manager.service.impl;

import com.example.ledger_manager.dto.AccountSnapshot;
import com.example.ledger_manager.dto.response.LedgerError;
import com.example.ledger_manager.dto.response.OperationResult;
import com.example.ledger_manager.mapper.AccountMapper;
import com.example.ledger_manager.service.AccountRegistry;
import com.example.ledger_manager.service.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
public class AccountRegistryImpl implements AccountRegistry {

    private static final int MAX_TEXT_LENGTH = 100;

    private final LedgerStore ledgerStore;
    private final AccountMapper accountMapper;

    public AccountRegistryImpl(LedgerStore ledgerStore, AccountMapper accountMapper) {
        this.ledgerStore = ledgerStore;
        this.accountMapper = accountMapper;
    }

    @Override
    @Transactional
    public OperationResult<AccountSnapshot> openAccount(String name, String occupation) {
        if (name == null || name.isBlank()) {
            log.warn("Rejected account creation: empty name");
            return OperationResult.failure(LedgerError.INVALID_INPUT, "Name is required.");
        }
        String trimmedName = name.strip();
        String trimmedOccupation = occupation == null || occupation.isBlank() ? null : occupation.strip();
        if (trimmedName.length() > MAX_TEXT_LENGTH
                || (trimmedOccupation != null && trimmedOccupation.length() > MAX_TEXT_LENGTH)) {
            log.warn("Rejected account creation: name or occupation longer than {} characters", MAX_TEXT_LENGTH);
            return OperationResult.failure(LedgerError.INVALID_INPUT,
                    "Name and occupation cannot exceed " + MAX_TEXT_LENGTH + " characters.");
        }

        Long id = ledgerStore.createAccount(trimmedName, trimmedOccupation);
        log.info("Created account {} for {} with occupation {}", id, trimmedName, trimmedOccupation);
        return findAccount(id);
    }

    @Override
    @Transactional
    public OperationResult<AccountSnapshot> closeAccount(Long id) {
        var found = findAccount(id);
        if (!found.isSuccess()) {
            log.warn("Cannot close account {}: not found", id);
            return found;
        }
        if (!ledgerStore.deleteAccount(id)) {
            log.warn("Cannot close account {}: removed before it could be locked", id);
            return OperationResult.failure(LedgerError.NOT_FOUND, "Account not found: " + id);
        }
        log.info("Closed account with client ID {}", id);
        return found;
    }

    @Override
    @Transactional(readOnly = true)
    public OperationResult<AccountSnapshot> findAccount(Long id) {
        if (id == null) {
            return OperationResult.failure(LedgerError.INVALID_INPUT, "Account id is required.");
        }
        return ledgerStore.getAccount(id)
                .map(accountMapper::toSnapshot)
                .map(OperationResult::success)
                .orElseGet(() -> OperationResult.failure(LedgerError.NOT_FOUND, "Account not found: " + id));
    }

    @Override
    @Transactional(readOnly = true)
    public List<AccountSnapshot> listAccounts() {
        var accounts = accountMapper.toSnapshots(ledgerStore.listAccounts());
        log.debug("Listed {} accounts", accounts.size());
        return accounts;
    }

    @Override
    @Transactional(readOnly = true)
    public long countAccounts() {
        long count = ledgerStore.countAccounts();
        log.debug("Total clients: {}", count);
        return count;
    }
}
