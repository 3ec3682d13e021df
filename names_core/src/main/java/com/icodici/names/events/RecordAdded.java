package com.icodici.names.events;

import com.icodici.names.ledger.LedgerEntry;

/**
 * A registration was appended to the record ledger.
 */
public class RecordAdded {

    private final LedgerEntry entry;

    public RecordAdded(LedgerEntry entry) {
        this.entry = entry;
    }

    public LedgerEntry getEntry() {
        return entry;
    }

    public int getIndex() {
        return entry.getIndex();
    }

    @Override
    public String toString() {
        return "RecordAdded(" + entry + ")";
    }
}
