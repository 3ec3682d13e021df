package com.icodici.names.factory;

import com.icodici.names.Address;
import com.icodici.names.Decimal;
import com.icodici.names.NamesConfig;
import com.icodici.names.ledger.RecordLedger;
import com.icodici.names.services.ResolverAddressBook;

/**
 * Shared wiring of the namespaces a factory deploys and the fee it charges. Replaced only as a whole.
 */
public final class FactoryConfig {

    private final ResolverAddressBook addressBook;
    private final RecordLedger recordLedger;
    private final Address feeReceiver;
    private final Decimal fee;

    public FactoryConfig(ResolverAddressBook addressBook, RecordLedger recordLedger, Address feeReceiver, Decimal fee) {
        if (addressBook == null || recordLedger == null || feeReceiver == null)
            throw new IllegalArgumentException("factory config is incomplete");
        if (fee == null || fee.isNegative())
            throw new IllegalArgumentException("namespace fee can't be negative: " + fee);
        this.addressBook = addressBook;
        this.recordLedger = recordLedger;
        this.feeReceiver = feeReceiver;
        this.fee = fee;
    }

    /**
     * Configuration charging the {@code namespace_fee} of the settings.
     */
    public static FactoryConfig from(NamesConfig settings, ResolverAddressBook addressBook, RecordLedger recordLedger,
                                     Address feeReceiver) {
        return new FactoryConfig(addressBook, recordLedger, feeReceiver, settings.getNamespaceFee());
    }

    public ResolverAddressBook getAddressBook() {
        return addressBook;
    }

    public RecordLedger getRecordLedger() {
        return recordLedger;
    }

    public Address getFeeReceiver() {
        return feeReceiver;
    }

    /**
     * Exact amount {@link NamespaceFactory#deployNamespace} accepts.
     */
    public Decimal getFee() {
        return fee;
    }

    @Override
    public String toString() {
        return "FactoryConfig(feeReceiver=" + feeReceiver + ", fee=" + fee + ")";
    }
}
