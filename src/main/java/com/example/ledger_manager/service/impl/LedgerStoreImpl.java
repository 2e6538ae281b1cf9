package com.example.ledger_manager.service.impl;

import com.example.ledger_manager.entity.Account;
import com.example.ledger_manager.entity.Movement;
import com.example.ledger_manager.entity.MovementKind;
import com.example.ledger_manager.exception.LedgerStorageException;
import com.example.ledger_manager.mapper.MovementMapper;
import com.example.ledger_manager.mapper.MovementParams;
import com.example.ledger_manager.repository.AccountRepository;
import com.example.ledger_manager.repository.MovementRepository;
import com.example.ledger_manager.service.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

@Slf4j
@Service
public class LedgerStoreImpl implements LedgerStore {

    private static final int SCALE = 2;

    private final AccountRepository accountRepository;
    private final MovementRepository movementRepository;
    private final MovementMapper movementMapper;

    public LedgerStoreImpl(AccountRepository accountRepository,
                           MovementRepository movementRepository,
                           MovementMapper movementMapper) {
        this.accountRepository = accountRepository;
        this.movementRepository = movementRepository;
        this.movementMapper = movementMapper;
    }

    @Override
    @Transactional
    public Long createAccount(String name, String occupation) {
        return storage("create account", () -> {
            var account = new Account();
            account.setName(name);
            account.setOccupation(occupation);
            account.setBalance(BigDecimal.ZERO.setScale(SCALE));
            return accountRepository.saveAndFlush(account).getId();
        });
    }

    @Override
    @Transactional
    public boolean deleteAccount(Long id) {
        return storage("delete account " + id, () -> {
            if (accountRepository.findAndLockById(id).isEmpty()) {
                return false;
            }
            // movements first: they reference the account row
            int removed = movementRepository.deleteAllByAccountId(id);
            accountRepository.deleteById(id);
            accountRepository.flush();
            log.debug("Removed account {} and {} movements", id, removed);
            return true;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> getAccount(Long id) {
        return storage("read account " + id, () -> accountRepository.findById(id));
    }

    @Override
    @Transactional
    public Optional<Account> lockAccount(Long id) {
        return storage("lock account " + id, () -> accountRepository.findAndLockById(id));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Account> listAccounts() {
        return storage("list accounts", accountRepository::findAllByOrderByIdAsc);
    }

    @Override
    @Transactional(readOnly = true)
    public long countAccounts() {
        return storage("count accounts", accountRepository::count);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Account updateBalance(Long id, BigDecimal newBalance) {
        if (newBalance == null || newBalance.signum() < 0) {
            throw new IllegalStateException("Balance of account " + id + " cannot become " + newBalance);
        }
        return storage("update balance of account " + id, () -> {
            var account = accountRepository.findAndLockById(id)
                    .orElseThrow(() -> new IllegalStateException("Account does not exist: " + id));
            account.setBalance(newBalance.setScale(SCALE, RoundingMode.UNNECESSARY));
            return accountRepository.saveAndFlush(account);
        });
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Movement appendMovement(Long accountId, MovementKind kind, BigDecimal amount, String transferReference) {
        return storage("append " + kind + " movement to account " + accountId, () -> {
            var params = new MovementParams();
            params.setAccountId(accountId);
            params.setKind(kind);
            params.setAmount(amount.setScale(SCALE, RoundingMode.UNNECESSARY));
            params.setTransferReference(transferReference);
            params.setMovementDt(LocalDateTime.now());

            var movement = movementMapper.toMovement(params);
            return movementRepository.saveAndFlush(movement);
        });
    }

    @Override
    @Transactional
    public Movement postMovement(Long accountId, MovementKind kind, BigDecimal signedAmount, String transferReference) {
        if (kind.isOutflow() != (signedAmount.signum() < 0)) {
            throw new IllegalArgumentException("Amount " + signedAmount + " has the wrong sign for " + kind);
        }
        var account = lockAccount(accountId)
                .orElseThrow(() -> new IllegalStateException("Account does not exist: " + accountId));
        updateBalance(accountId, account.getBalance().add(signedAmount));
        return appendMovement(accountId, kind, signedAmount, transferReference);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Movement> listMovements(Long accountId) {
        return storage("list movements of account " + accountId,
                () -> movementRepository.findAllByAccountIdOrderByIdAsc(accountId));
    }

    @Override
    @Transactional(readOnly = true)
    public BigDecimal sumMovements(Long accountId) {
        return storage("sum movements of account " + accountId,
                () -> movementRepository.sumAmountByAccountId(accountId));
    }

    private <T> T storage(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Storage failure while trying to {}", operation, e);
            throw new LedgerStorageException("Could not " + operation + ": " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
