package com.icodici.names.events;

import com.icodici.names.Address;
import com.icodici.names.Decimal;
import com.icodici.names.NameHash;
import com.icodici.names.TokenId;

import java.time.ZonedDateTime;

public class DomainRegistered extends RegistryEvent {

    private final TokenId tokenId;
    private final Address owner;
    private final Decimal price;
    private final ZonedDateTime expiresAt;

    public DomainRegistered(String namespace, String name, NameHash nameHash, TokenId tokenId, Address owner,
                            Decimal price, ZonedDateTime registeredAt, ZonedDateTime expiresAt) {
        super(namespace, name, nameHash, registeredAt);
        this.tokenId = tokenId;
        this.owner = owner;
        this.price = price;
        this.expiresAt = expiresAt;
    }

    public TokenId getTokenId() {
        return tokenId;
    }

    public Address getOwner() {
        return owner;
    }

    public Decimal getPrice() {
        return price;
    }

    public ZonedDateTime getRegisteredAt() {
        return getTimestamp();
    }

    public ZonedDateTime getExpiresAt() {
        return expiresAt;
    }
}
