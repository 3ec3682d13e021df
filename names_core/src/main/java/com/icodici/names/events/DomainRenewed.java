package com.icodici.names.events;

import com.icodici.names.Address;
import com.icodici.names.Decimal;
import com.icodici.names.NameHash;

import java.time.ZonedDateTime;

public class DomainRenewed extends RegistryEvent {

    private final Address owner;
    private final Decimal price;
    private final ZonedDateTime previousExpiresAt;
    private final ZonedDateTime expiresAt;

    public DomainRenewed(String namespace, String name, NameHash nameHash, Address owner, Decimal price,
                         ZonedDateTime renewedAt, ZonedDateTime previousExpiresAt, ZonedDateTime expiresAt) {
        super(namespace, name, nameHash, renewedAt);
        this.owner = owner;
        this.price = price;
        this.previousExpiresAt = previousExpiresAt;
        this.expiresAt = expiresAt;
    }

    public Address getOwner() {
        return owner;
    }

    public Decimal getPrice() {
        return price;
    }

    public ZonedDateTime getPreviousExpiresAt() {
        return previousExpiresAt;
    }

    public ZonedDateTime getExpiresAt() {
        return expiresAt;
    }
}
