package com.demo.thrift.repository;

import com.demo.thrift.model.Reputation;
import com.demo.thrift.tx.JournaledMap;
import com.demo.thrift.tx.LedgerTransactions;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class ReputationRepository {

    private final JournaledMap<String, Reputation> reputations;

    public ReputationRepository(LedgerTransactions transactions) {
        this.reputations = new JournaledMap<>(transactions);
    }

    public Optional<Reputation> find(String address) {
        return reputations.get(address);
    }

    public Reputation save(Reputation reputation) {
        reputations.put(reputation.address(), reputation);
        return reputation;
    }
}
