package com.icodici.names.events;

import com.icodici.names.Address;
import com.icodici.names.NameHash;
import com.icodici.names.TokenId;

import java.time.ZonedDateTime;

public class SubDomainCreated extends RegistryEvent {

    private final NameHash parentHash;
    private final TokenId tokenId;
    private final Address owner;
    private final ZonedDateTime expiresAt;

    public SubDomainCreated(String namespace, String subName, NameHash nameHash, NameHash parentHash,
                            TokenId tokenId, Address owner, ZonedDateTime createdAt, ZonedDateTime expiresAt) {
        super(namespace, subName, nameHash, createdAt);
        this.parentHash = parentHash;
        this.tokenId = tokenId;
        this.owner = owner;
        this.expiresAt = expiresAt;
    }

    public NameHash getParentHash() {
        return parentHash;
    }

    public TokenId getTokenId() {
        return tokenId;
    }

    public Address getOwner() {
        return owner;
    }

    public ZonedDateTime getExpiresAt() {
        return expiresAt;
    }
}
