package com.example.ledger_manager.service;

import com.example.ledger_manager.entity.Account;
import com.example.ledger_manager.entity.Movement;
import com.example.ledger_manager.entity.MovementKind;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of accounts and their append-only movement log.
 *
 * <p>Every method runs in a scoped transaction and joins the caller's transaction
 * when there is one, so several calls made from one engine operation commit or roll
 * back together. Storage errors surface as
 * {@link com.example.ledger_manager.exception.LedgerStorageException}.
 */
public interface LedgerStore {

    /**
     * Inserts an account with a zero balance.
     *
     * @return the identifier assigned by the database
     */
    Long createAccount(String name, String occupation);

    /**
     * Removes the account and every movement that references it.
     *
     * @return {@code false} when no account has the given id
     */
    boolean deleteAccount(Long id);

    Optional<Account> getAccount(Long id);

    /**
     * Like {@link #getAccount(Long)}, but holds a write lock on the row until the
     * surrounding transaction ends.
     */
    Optional<Account> lockAccount(Long id);

    List<Account> listAccounts();

    long countAccounts();

    /**
     * Must run inside an existing transaction together with the matching
     * {@link #appendMovement}; prefer {@link #postMovement}.
     *
     * @throws org.springframework.transaction.IllegalTransactionStateException when called outside a transaction
     */
    Account updateBalance(Long id, BigDecimal newBalance);

    /**
     * Must run inside an existing transaction together with the matching
     * {@link #updateBalance}; prefer {@link #postMovement}.
     *
     * @throws org.springframework.transaction.IllegalTransactionStateException when called outside a transaction
     */
    Movement appendMovement(Long accountId, MovementKind kind, BigDecimal amount, String transferReference);

    /**
     * Applies {@code signedAmount} to the account balance and appends the matching
     * movement as one unit. Neither change is visible without the other.
     *
     * @throws IllegalStateException if the posting would leave the balance negative
     */
    Movement postMovement(Long accountId, MovementKind kind, BigDecimal signedAmount, String transferReference);

    List<Movement> listMovements(Long accountId);

    BigDecimal sumMovements(Long accountId);
}
