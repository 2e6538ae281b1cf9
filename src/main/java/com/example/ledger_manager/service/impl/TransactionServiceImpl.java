package com.example.ledger_manager.service.impl;

import com.example.ledger_manager.config.LedgerProperties;
import com.example.ledger_manager.dto.AccountSnapshot;
import com.example.ledger_manager.dto.MovementView;
import com.example.ledger_manager.dto.response.LedgerError;
import com.example.ledger_manager.dto.response.OperationResult;
import com.example.ledger_manager.dto.response.TransferReceipt;
import com.example.ledger_manager.entity.Account;
import com.example.ledger_manager.entity.MovementKind;
import com.example.ledger_manager.mapper.AccountMapper;
import com.example.ledger_manager.mapper.MovementMapper;
import com.example.ledger_manager.service.AccountRegistry;
import com.example.ledger_manager.service.IdGeneratorService;
import com.example.ledger_manager.service.LedgerStore;
import com.example.ledger_manager.service.TransactionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class TransactionServiceImpl implements TransactionService {

    // amounts are stored with exactly two decimals
    private static final int SCALE = 2;

    private final LedgerStore ledgerStore;
    private final AccountRegistry accountRegistry;
    private final IdGeneratorService idGeneratorService;
    private final AccountMapper accountMapper;
    private final MovementMapper movementMapper;
    private final LedgerProperties ledgerProperties;

    public TransactionServiceImpl(LedgerStore ledgerStore,
                                  AccountRegistry accountRegistry,
                                  IdGeneratorService idGeneratorService,
                                  AccountMapper accountMapper,
                                  MovementMapper movementMapper,
                                  LedgerProperties ledgerProperties) {
        this.ledgerStore = ledgerStore;
        this.accountRegistry = accountRegistry;
        this.idGeneratorService = idGeneratorService;
        this.accountMapper = accountMapper;
        this.movementMapper = movementMapper;
        this.ledgerProperties = ledgerProperties;
    }

    @Override
    @Transactional
    public OperationResult<AccountSnapshot> withdraw(AccountSnapshot account, BigDecimal amount) {
        // 1) Amount
        String amountProblem = validateAmount(amount);
        if (amountProblem != null) {
            log.warn("Rejected withdrawal from account {}: {}", idOf(account), amountProblem);
            return OperationResult.failure(LedgerError.INVALID_AMOUNT, amountProblem);
        }
        BigDecimal normalized = normalize(amount);

        // 2) Account, re-read under lock: the snapshot may be stale
        Optional<Account> locked = lockAccount(account);
        if (locked.isEmpty()) {
            return accountNotFound(account);
        }
        Account entity = locked.get();

        // 3) Funds
        if (!hasFunds(entity, normalized)) {
            log.warn("Insufficient funds: account {} has {}, withdrawal of {} requested",
                    entity.getId(), entity.getBalance(), normalized);
            return insufficientFunds(entity, normalized);
        }

        // 4) Balance and movement as one unit
        ledgerStore.postMovement(entity.getId(), MovementKind.WITHDRAW, normalized.negate(), null);
        log.info("Withdrawn {} from client ID {}", normalized, entity.getId());
        return OperationResult.success(reload(entity.getId()));
    }

    @Override
    @Transactional
    public OperationResult<AccountSnapshot> deposit(AccountSnapshot account, BigDecimal amount) {
        String amountProblem = validateAmount(amount);
        if (amountProblem != null) {
            log.warn("Rejected deposit to account {}: {}", idOf(account), amountProblem);
            return OperationResult.failure(LedgerError.INVALID_AMOUNT, amountProblem);
        }
        BigDecimal normalized = normalize(amount);

        Optional<Account> locked = lockAccount(account);
        if (locked.isEmpty()) {
            return accountNotFound(account);
        }
        Long accountId = locked.get().getId();

        ledgerStore.postMovement(accountId, MovementKind.DEPOSIT, normalized, null);
        log.info("Deposited {} to client ID {}", normalized, accountId);
        return OperationResult.success(reload(accountId));
    }

    @Override
    @Transactional
    public OperationResult<TransferReceipt> transfer(AccountSnapshot source, Long destinationId, BigDecimal amount) {
        // 1) Source
        if (source == null || source.id() == null || !accountRegistry.findAccount(source.id()).isSuccess()) {
            return accountNotFound(source);
        }
        Long sourceId = source.id();

        // 2) Destination
        if (destinationId == null || !accountRegistry.findAccount(destinationId).isSuccess()) {
            log.warn("Client to transfer to (ID: {}) not found", destinationId);
            return OperationResult.failure(LedgerError.DESTINATION_NOT_FOUND,
                    "Destination account not found: " + destinationId);
        }
        if (sourceId.equals(destinationId)) {
            log.warn("Rejected transfer from account {} to itself", sourceId);
            return OperationResult.failure(LedgerError.INVALID_INPUT,
                    "Source and destination accounts must be different.");
        }

        // 3) Amount
        String amountProblem = validateAmount(amount);
        if (amountProblem != null) {
            log.warn("Rejected transfer from account {} to {}: {}", sourceId, destinationId, amountProblem);
            return OperationResult.failure(LedgerError.INVALID_AMOUNT, amountProblem);
        }
        BigDecimal normalized = normalize(amount);

        // 4) Lock both rows in ascending id order
        LockedPair pair = lockInIdOrder(sourceId, destinationId);
        if (pair == null) {
            // closed between the lookup and the lock
            return OperationResult.failure(LedgerError.NOT_FOUND, "Account no longer exists.");
        }

        // 5) Source funds
        if (!hasFunds(pair.source(), normalized)) {
            log.warn("Insufficient funds: account {} has {}, transfer of {} requested",
                    sourceId, pair.source().getBalance(), normalized);
            return insufficientFunds(pair.source(), normalized);
        }

        // 6) Both legs share one reference; a failure in either rolls back both
        String transferReference = idGeneratorService.nextTransferReference();
        ledgerStore.postMovement(sourceId, MovementKind.TRANSFER_OUT, normalized.negate(), transferReference);
        ledgerStore.postMovement(destinationId, MovementKind.TRANSFER_IN, normalized, transferReference);

        log.info("Transferred {} from client ID {} to client ID {} (reference {})",
                normalized, sourceId, destinationId, transferReference);
        return OperationResult.success(new TransferReceipt(
                transferReference,
                reload(sourceId),
                reload(destinationId),
                normalized
        ));
    }

    @Override
    @Transactional(readOnly = true)
    public OperationResult<BigDecimal> checkBalance(AccountSnapshot account) {
        return findPersisted(account).map(found -> {
            log.debug("Client ID {} balance: {}", found.id(), found.balance());
            return found.balance();
        });
    }

    @Override
    @Transactional(readOnly = true)
    public OperationResult<List<MovementView>> showMovements(AccountSnapshot account) {
        return findPersisted(account).map(found -> {
            List<MovementView> movements = movementMapper.toViews(ledgerStore.listMovements(found.id()));
            log.debug("Client ID {} has {} movements", found.id(), movements.size());
            return movements;
        });
    }

    private String validateAmount(BigDecimal amount) {
        if (amount == null) {
            return "Amount is required.";
        }
        if (amount.signum() <= 0) {
            return "Amount must be greater than zero.";
        }
        if (amount.stripTrailingZeros().scale() > SCALE) {
            return "Amount cannot have more than " + SCALE + " decimal places.";
        }
        BigDecimal maxAmount = ledgerProperties.getLimits().getMaxAmount();
        if (maxAmount != null && amount.compareTo(maxAmount) > 0) {
            return "Amount cannot exceed " + maxAmount.toPlainString() + ".";
        }
        return null;
    }

    private BigDecimal normalize(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    private boolean hasFunds(Account account, BigDecimal amount) {
        return account.getBalance().compareTo(amount) >= 0;
    }

    private Optional<Account> lockAccount(AccountSnapshot account) {
        if (account == null || account.id() == null) {
            return Optional.empty();
        }
        return ledgerStore.lockAccount(account.id());
    }

    private LockedPair lockInIdOrder(Long sourceId, Long destinationId) {
        Long firstId = sourceId.compareTo(destinationId) < 0 ? sourceId : destinationId;
        Long secondId = firstId.equals(sourceId) ? destinationId : sourceId;

        Optional<Account> first = ledgerStore.lockAccount(firstId);
        Optional<Account> second = ledgerStore.lockAccount(secondId);
        if (first.isEmpty() || second.isEmpty()) {
            return null;
        }
        return firstId.equals(sourceId)
                ? new LockedPair(first.get(), second.get())
                : new LockedPair(second.get(), first.get());
    }

    private OperationResult<AccountSnapshot> findPersisted(AccountSnapshot account) {
        if (account == null || account.id() == null) {
            return OperationResult.failure(LedgerError.NOT_FOUND, "Account not found.");
        }
        return accountRegistry.findAccount(account.id());
    }

    private AccountSnapshot reload(Long accountId) {
        return ledgerStore.getAccount(accountId)
                .map(accountMapper::toSnapshot)
                .orElseThrow(() -> new IllegalStateException("Account vanished inside its own transaction: " + accountId));
    }

    private <T> OperationResult<T> accountNotFound(AccountSnapshot account) {
        log.warn("Account {} not found", idOf(account));
        return OperationResult.failure(LedgerError.NOT_FOUND, "Account not found: " + idOf(account));
    }

    private <T> OperationResult<T> insufficientFunds(Account account, BigDecimal requested) {
        return OperationResult.failure(LedgerError.INSUFFICIENT_FUNDS,
                "Current balance is " + account.getBalance().toPlainString()
                        + ", and " + requested.toPlainString() + " is needed.");
    }

    private static Long idOf(AccountSnapshot account) {
        return account == null ? null : account.id();
    }

    private record LockedPair(Account source, Account destination) {}
}
