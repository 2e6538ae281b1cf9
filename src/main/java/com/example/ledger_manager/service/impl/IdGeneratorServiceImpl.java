package com.example.ledger_manager.service.impl;

import com.example.ledger_manager.service.IdGeneratorService;
import com.github.f4b6a3.ulid.UlidCreator;
import org.springframework.stereotype.Service;

@Service
public class IdGeneratorServiceImpl implements IdGeneratorService {

    @Override
    public String nextTransferReference() {
        // monotonic so references issued in the same millisecond still sort by creation
        return UlidCreator.getMonotonicUlid().toString();
    }
}
