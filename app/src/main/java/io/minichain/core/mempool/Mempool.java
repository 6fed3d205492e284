package io.minichain.core.mempool;

import io.minichain.core.protocol.Hash;
import io.minichain.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal mempool:
 * - holds transactions keyed by identity hash (one pending copy per identity)
 * - iteration and drain return txs in FIFO by insertion
 */
public final class Mempool {

    private final Map<Hash, Transaction> pending = new LinkedHashMap<>();

    /** Add a tx, rejecting a second copy of a pending identity. */
    public synchronized void add(Transaction tx) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction required");
        }
        Hash id = tx.identityHash();
        if (pending.containsKey(id)) {
            throw new DuplicateTransactionException(id);
        }
        pending.put(id, tx);
    }

    /** Remove and return everything pending, leaving the pool empty. */
    public synchronized List<Transaction> drain() {
        List<Transaction> out = new ArrayList<>(pending.values());
        pending.clear();
        return out;
    }

    /**
     * Put back the transactions of an abandoned block, ahead of anything submitted since.
     * Identities that are pending again are skipped.
     */
    public synchronized void restore(Collection<Transaction> txs) {
        if (txs == null || txs.isEmpty()) {
            return;
        }
        Map<Hash, Transaction> merged = new LinkedHashMap<>();
        for (Transaction tx : txs) {
            merged.putIfAbsent(tx.identityHash(), tx);
        }
        for (Map.Entry<Hash, Transaction> e : pending.entrySet()) {
            merged.putIfAbsent(e.getKey(), e.getValue());
        }
        pending.clear();
        pending.putAll(merged);
    }

    /** Drop pending transactions whose identity is in {@code identities}. Returns how many were dropped. */
    public synchronized int removeAll(Collection<Hash> identities) {
        int removed = 0;
        for (Hash id : identities) {
            if (pending.remove(id) != null) {
                removed++;
            }
        }
        return removed;
    }

    public synchronized boolean contains(Hash identityHash) {
        return pending.containsKey(identityHash);
    }

    /** Snapshot of pending transactions in insertion order. */
    public synchronized List<Transaction> pending() {
        return List.copyOf(pending.values());
    }

    public synchronized int size() { return pending.size(); }
}
