package com.example.ledger_manager.repository;

import com.example.ledger_manager.entity.Movement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface MovementRepository extends JpaRepository<Movement, Long> {

    List<Movement> findAllByAccountIdOrderByIdAsc(Long accountId);

    List<Movement> findAllByTransferReferenceOrderByIdAsc(String transferReference);

    @Query("select coalesce(sum(m.amount), 0) from Movement m where m.accountId = :accountId")
    BigDecimal sumAmountByAccountId(@Param("accountId") Long accountId);

    // bulk delete: movements are @Immutable, so they are never removed one by one
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Movement m where m.accountId = :accountId")
    int deleteAllByAccountId(@Param("accountId") Long accountId);
}
