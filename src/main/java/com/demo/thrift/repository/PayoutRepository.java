package com.demo.thrift.repository;

import com.demo.thrift.exception.PreconditionFailedException;
import com.demo.thrift.model.Payout;
import com.demo.thrift.tx.JournaledMap;
import com.demo.thrift.tx.LedgerTransactions;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class PayoutRepository {

    private final JournaledMap<Key, Payout> payouts;

    public PayoutRepository(LedgerTransactions transactions) {
        this.payouts = new JournaledMap<>(transactions);
    }

    public Payout insert(Payout payout) {
        Key key = new Key(payout.groupId(), payout.cycle());
        if (payouts.containsKey(key)) {
            throw new PreconditionFailedException("Cycle " + payout.cycle() + " already paid out");
        }
        payouts.put(key, payout);
        return payout;
    }

    public Payout save(Payout payout) {
        payouts.put(new Key(payout.groupId(), payout.cycle()), payout);
        return payout;
    }

    public Optional<Payout> find(long groupId, int cycle) {
        return payouts.get(new Key(groupId, cycle));
    }

    public List<Payout> findByGroup(long groupId) {
        return payouts.values(p -> p.groupId() == groupId);
    }

    public List<Payout> findPending(long groupId, String recipient) {
        return payouts.values(p -> p.groupId() == groupId && !p.executed() && p.recipient().equals(recipient));
    }

    private record Key(long groupId, int cycle) {}
}
