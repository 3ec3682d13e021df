package com.icodici.names.ledger;

import com.icodici.names.Address;
import com.icodici.names.Decimal;

import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Immutable record of one completed top-level registration. Later renewals, resolver changes or burns of the name
 * never change it.
 */
public final class LedgerEntry {

    private final int index;
    private final String fullName;
    private final Address owner;
    private final ZonedDateTime registeredAt;
    private final ZonedDateTime expiresAt;
    private final Decimal price;
    private final Address source;

    LedgerEntry(int index, String fullName, Address owner, ZonedDateTime registeredAt, ZonedDateTime expiresAt,
                Decimal price, Address source) {
        this.index = index;
        this.fullName = fullName;
        this.owner = owner;
        this.registeredAt = registeredAt;
        this.expiresAt = expiresAt;
        this.price = price;
        this.source = source;
    }

    /**
     * Position in the ledger, starting from 0.
     */
    public int getIndex() {
        return index;
    }

    /**
     * Name with its namespace, like {@code alice.eth}.
     */
    public String getFullName() {
        return fullName;
    }

    public Address getOwner() {
        return owner;
    }

    public ZonedDateTime getRegisteredAt() {
        return registeredAt;
    }

    /**
     * Expiration as of the registration moment.
     */
    public ZonedDateTime getExpiresAt() {
        return expiresAt;
    }

    public Decimal getPrice() {
        return price;
    }

    /**
     * Registry the registration happened in.
     */
    public Address getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LedgerEntry)) return false;
        LedgerEntry that = (LedgerEntry) o;
        return index == that.index && fullName.equals(that.fullName) && owner.equals(that.owner)
                && registeredAt.equals(that.registeredAt) && expiresAt.equals(that.expiresAt)
                && price.equals(that.price) && source.equals(that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, fullName, owner, source);
    }

    @Override
    public String toString() {
        return "#" + index + " " + fullName + " by " + owner + " at " + registeredAt + " for " + price;
    }
}
