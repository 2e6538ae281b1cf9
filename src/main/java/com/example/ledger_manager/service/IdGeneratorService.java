package com.example.ledger_manager.service;

public interface IdGeneratorService {

    String nextTransferReference();
}
