package com.icodici.names.ledger;

import com.icodici.names.Address;
import com.icodici.names.Decimal;
import com.icodici.names.Errors;
import com.icodici.names.events.RecordAdded;
import com.icodici.names.exception.NameServiceError;
import com.icodici.names.tools.Informer;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only history of top-level registrations, shared by all namespaces of a factory. Besides the master log it
 * keeps two secondary indexes, by owner and by source registry, holding positions in the log in append order.
 * Nothing here is ever updated or removed.
 */
public class RecordLedger {

    private final List<LedgerEntry> entries = new ArrayList<>();
    private final Map<Address, List<Integer>> byOwner = new HashMap<>();
    private final Map<Address, List<Integer>> bySource = new HashMap<>();
    private final Informer informer;

    public RecordLedger() {
        this(null);
    }

    /**
     * @param informer to post {@link RecordAdded} to, or null
     */
    public RecordLedger(@Nullable Informer informer) {
        this.informer = informer;
    }

    /**
     * Append a registration.
     *
     * @return the appended entry
     */
    public @NonNull LedgerEntry append(@NonNull String fullName, @NonNull Address owner,
                                       @NonNull ZonedDateTime registeredAt, @NonNull ZonedDateTime expiresAt,
                                       @NonNull Decimal price, @NonNull Address source) {
        if (fullName == null || owner == null || registeredAt == null || expiresAt == null || price == null
                || source == null)
            throw new IllegalArgumentException("ledger entry fields can't be null");
        LedgerEntry entry;
        synchronized (this) {
            entry = new LedgerEntry(entries.size(), fullName, owner, registeredAt, expiresAt, price, source);
            entries.add(entry);
            byOwner.computeIfAbsent(owner, k -> new ArrayList<>()).add(entry.getIndex());
            bySource.computeIfAbsent(source, k -> new ArrayList<>()).add(entry.getIndex());
        }
        if (informer != null)
            informer.post(new RecordAdded(entry));
        return entry;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized @NonNull List<LedgerEntry> allEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * @throws NameServiceError with {@link Errors#NOT_FOUND} if there is no such index
     */
    public synchronized @NonNull LedgerEntry entryAt(int index) throws NameServiceError {
        if (index < 0 || index >= entries.size())
            throw new NameServiceError(Errors.NOT_FOUND, "index",
                    "no ledger entry at " + index + ", ledger size is " + entries.size());
        return entries.get(index);
    }

    public synchronized @NonNull List<LedgerEntry> entriesByOwner(Address owner) {
        return project(byOwner.get(owner));
    }

    public synchronized @NonNull List<LedgerEntry> entriesBySource(Address source) {
        return project(bySource.get(source));
    }

    private List<LedgerEntry> project(List<Integer> indexes) {
        if (indexes == null)
            return Collections.emptyList();
        List<LedgerEntry> result = new ArrayList<>(indexes.size());
        for (int i : indexes)
            result.add(entries.get(i));
        return Collections.unmodifiableList(result);
    }
}
