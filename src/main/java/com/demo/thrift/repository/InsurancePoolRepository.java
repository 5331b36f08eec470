package com.demo.thrift.repository;

import com.demo.thrift.model.InsurancePool;
import com.demo.thrift.tx.JournaledMap;
import com.demo.thrift.tx.LedgerTransactions;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class InsurancePoolRepository {

    private final JournaledMap<Long, InsurancePool> pools;

    public InsurancePoolRepository(LedgerTransactions transactions) {
        this.pools = new JournaledMap<>(transactions);
    }

    public Optional<InsurancePool> find(long groupId) {
        return pools.get(groupId);
    }

    public List<InsurancePool> findAll() {
        return pools.values();
    }

    public InsurancePool save(InsurancePool pool) {
        pools.put(pool.groupId(), pool);
        return pool;
    }
}
