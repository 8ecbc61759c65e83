package com.ayni.core.journal;

import com.ayni.core.registry.RegistryTransaction;

import java.util.List;

/**
 * Durable, ordered log of committed transactions. Replaying it rebuilds registry state.
 */
public interface RegistryJournal {

    /**
     * Appends a transaction that is about to commit.
     *
     * @throws JournalException if the entry could not be made durable
     */
    void append(RegistryTransaction transaction);

    /**
     * All committed transactions in commit order.
     */
    List<RegistryTransaction> readAll();
}
