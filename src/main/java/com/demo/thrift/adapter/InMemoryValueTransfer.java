package com.demo.thrift.adapter;

import com.demo.thrift.exception.InvalidInputException;
import com.demo.thrift.service.ValueTransfer;
import com.demo.thrift.tx.JournaledMap;
import com.demo.thrift.tx.LedgerTransactions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Settlement asset kept in process. Balances are journaled, so a transfer made inside a ledger
 * operation is undone together with it. {@code transferFrom} treats every owner as having approved
 * the protocol accounts.
 */
@Slf4j
@Component
public class InMemoryValueTransfer implements ValueTransfer {

    private final LedgerTransactions transactions;
    private final JournaledMap<String, Long> balances;

    public InMemoryValueTransfer(LedgerTransactions transactions) {
        this.transactions = transactions;
        this.balances = new JournaledMap<>(transactions);
    }

    @Override
    public boolean transfer(String from, String to, long amount) {
        return move(from, to, amount);
    }

    @Override
    public boolean transferFrom(String owner, String to, long amount) {
        return move(owner, to, amount);
    }

    @Override
    public long balanceOf(String account) {
        return balances.get(account).orElse(0L);
    }

    /** Creates {@code amount} out of thin air for {@code account}; test and demo funding only. */
    public long mint(String account, long amount) {
        if (amount <= 0) {
            throw new InvalidInputException("amount must be positive");
        }
        return transactions.execute("value-transfer:mint", () -> {
            long next = Math.addExact(balanceOf(account), amount);
            balances.put(account, next);
            log.debug("Minted {} to {}", amount, account);
            return next;
        });
    }

    private boolean move(String from, String to, long amount) {
        if (amount < 0) {
            throw new InvalidInputException("amount must not be negative");
        }
        if (from == null || to == null) {
            throw new InvalidInputException("account is required");
        }
        if (amount == 0) {
            return true;
        }
        long available = balanceOf(from);
        if (available < amount) {
            return false;
        }
        balances.put(from, available - amount);
        balances.put(to, Math.addExact(balanceOf(to), amount));
        return true;
    }
}
