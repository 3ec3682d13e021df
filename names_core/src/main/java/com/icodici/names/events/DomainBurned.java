package com.icodici.names.events;

import com.icodici.names.NameHash;
import com.icodici.names.TokenId;

import java.time.ZonedDateTime;

public class DomainBurned extends RegistryEvent {

    private final TokenId tokenId;

    public DomainBurned(String namespace, String name, NameHash nameHash, TokenId tokenId, ZonedDateTime at) {
        super(namespace, name, nameHash, at);
        this.tokenId = tokenId;
    }

    public TokenId getTokenId() {
        return tokenId;
    }
}
