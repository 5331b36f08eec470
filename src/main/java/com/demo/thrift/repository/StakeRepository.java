package com.demo.thrift.repository;

import com.demo.thrift.model.StakeRecord;
import com.demo.thrift.tx.JournaledMap;
import com.demo.thrift.tx.LedgerTransactions;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class StakeRepository {

    private final JournaledMap<Key, StakeRecord> stakes;

    public StakeRepository(LedgerTransactions transactions) {
        this.stakes = new JournaledMap<>(transactions);
    }

    public Optional<StakeRecord> find(long groupId, String member) {
        return stakes.get(new Key(groupId, member));
    }

    public List<StakeRecord> findByGroup(long groupId) {
        return stakes.values(s -> s.groupId() == groupId);
    }

    public List<StakeRecord> findByMember(String member) {
        return stakes.values(s -> s.member().equals(member));
    }

    public StakeRecord save(StakeRecord stake) {
        stakes.put(new Key(stake.groupId(), stake.member()), stake);
        return stake;
    }

    private record Key(long groupId, String member) {}
}
