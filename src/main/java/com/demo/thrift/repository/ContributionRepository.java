package com.demo.thrift.repository;

import com.demo.thrift.exception.PreconditionFailedException;
import com.demo.thrift.model.Contribution;
import com.demo.thrift.tx.JournaledMap;
import com.demo.thrift.tx.LedgerTransactions;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class ContributionRepository {

    private final JournaledMap<Key, Contribution> contributions;

    public ContributionRepository(LedgerTransactions transactions) {
        this.contributions = new JournaledMap<>(transactions);
    }

    /** Insert-only: a second record for the same (group, cycle, member) is refused. */
    public Contribution insert(Contribution c) {
        Key key = new Key(c.groupId(), c.cycle(), c.member());
        if (contributions.containsKey(key)) {
            throw new PreconditionFailedException(
                    "Cycle " + c.cycle() + " already settled for " + c.member());
        }
        contributions.put(key, c);
        return c;
    }

    public Optional<Contribution> find(long groupId, int cycle, String member) {
        return contributions.get(new Key(groupId, cycle, member));
    }

    public boolean exists(long groupId, int cycle, String member) {
        return contributions.containsKey(new Key(groupId, cycle, member));
    }

    public List<Contribution> findByGroup(long groupId) {
        return contributions.values(c -> c.groupId() == groupId);
    }

    public List<Contribution> findByGroupAndCycle(long groupId, int cycle) {
        return contributions.values(c -> c.groupId() == groupId && c.cycle() == cycle);
    }

    private record Key(long groupId, int cycle, String member) {}
}
