package com.demo.thrift.repository;

import com.demo.thrift.model.EscrowBalance;
import com.demo.thrift.tx.JournaledMap;
import com.demo.thrift.tx.LedgerTransactions;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/** Group balances plus the per-recipient breakdown of their pending payouts. */
@Repository
public class EscrowBalanceRepository {

    private final JournaledMap<Long, EscrowBalance> balances;
    private final JournaledMap<PendingKey, Long> pending;

    public EscrowBalanceRepository(LedgerTransactions transactions) {
        this.balances = new JournaledMap<>(transactions);
        this.pending = new JournaledMap<>(transactions);
    }

    public Optional<EscrowBalance> find(long groupId) {
        return balances.get(groupId);
    }

    public List<EscrowBalance> findAll() {
        return balances.values();
    }

    public EscrowBalance save(EscrowBalance balance) {
        balances.put(balance.groupId(), balance);
        return balance;
    }

    public long pendingFor(long groupId, String recipient) {
        return pending.get(new PendingKey(groupId, recipient)).orElse(0L);
    }

    public void savePending(long groupId, String recipient, long amount) {
        pending.put(new PendingKey(groupId, recipient), amount);
    }

    private record PendingKey(long groupId, String recipient) {}
}
