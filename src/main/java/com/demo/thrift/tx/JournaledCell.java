package com.demo.thrift.tx;

/** Single journaled value, e.g. a sequence counter. */
public class JournaledCell<T> {

    private final LedgerTransactions transactions;
    private T value;

    public JournaledCell(LedgerTransactions transactions, T initial) {
        this.transactions = transactions;
        this.value = initial;
    }

    public synchronized T get() {
        return value;
    }

    public synchronized void set(T next) {
        T previous = value;
        transactions.recordUndo(() -> restore(previous));
        value = next;
    }

    private synchronized void restore(T previous) {
        value = previous;
    }
}
