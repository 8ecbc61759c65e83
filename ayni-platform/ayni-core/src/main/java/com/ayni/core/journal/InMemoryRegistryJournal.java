package com.ayni.core.journal;

import com.ayni.core.registry.RegistryTransaction;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Journal kept only for the lifetime of the process.
 */
public class InMemoryRegistryJournal implements RegistryJournal {

    private final List<RegistryTransaction> transactions = new CopyOnWriteArrayList<>();

    @Override
    public void append(RegistryTransaction transaction) {
        transactions.add(Objects.requireNonNull(transaction, "Transaction cannot be null"));
    }

    @Override
    public List<RegistryTransaction> readAll() {
        return List.copyOf(transactions);
    }
}
