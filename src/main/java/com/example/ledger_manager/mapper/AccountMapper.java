package com.example.ledger_manager.mapper;

import com.example.ledger_manager.dto.AccountSnapshot;
import com.example.ledger_manager.entity.Account;
import org.mapstruct.Mapper;

import java.util.List;

@Mapper(componentModel = "spring")
public interface AccountMapper {

    AccountSnapshot toSnapshot(Account account);

    List<AccountSnapshot> toSnapshots(List<Account> accounts);
}
