package com.demo.thrift.tx;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Insertion-ordered key/value store whose writes are undone when the enclosing
 * {@link LedgerTransactions} operation fails. Values are expected to be immutable.
 */
public class JournaledMap<K, V> {

    private final LedgerTransactions transactions;
    private final Map<K, V> entries = new LinkedHashMap<>();

    public JournaledMap(LedgerTransactions transactions) {
        this.transactions = transactions;
    }

    public synchronized Optional<V> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public synchronized boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public synchronized void put(K key, V value) {
        V previous = entries.get(key);
        transactions.recordUndo(() -> restore(key, previous));
        entries.put(key, value);
    }

    public synchronized List<V> values() {
        return new ArrayList<>(entries.values());
    }

    public synchronized List<V> values(Predicate<? super V> filter) {
        List<V> out = new ArrayList<>();
        for (V v : entries.values()) {
            if (filter.test(v)) out.add(v);
        }
        return out;
    }

    public synchronized int size() {
        return entries.size();
    }

    private synchronized void restore(K key, V previous) {
        if (previous == null) {
            entries.remove(key);
        } else {
            entries.put(key, previous);
        }
    }
}
