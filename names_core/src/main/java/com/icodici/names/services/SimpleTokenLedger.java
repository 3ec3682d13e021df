package com.icodici.names.services;

import com.icodici.names.Address;
import com.icodici.names.TokenId;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link TokenLedger}. Besides the operations the registry needs it supports holder-initiated transfers,
 * which is how a name changes hands without touching the registry.
 */
public class SimpleTokenLedger implements TokenLedger {

    private final String name;
    private final String symbol;
    private final AtomicLong lastId = new AtomicLong(0);
    private final Map<TokenId, Address> owners = new ConcurrentHashMap<>();

    public SimpleTokenLedger(String name, String symbol) {
        this.name = name;
        this.symbol = symbol;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getSymbol() {
        return symbol;
    }

    @Override
    public TokenId mint(Address owner) {
        if (owner == null)
            throw new IllegalArgumentException("can't mint to nobody");
        TokenId id = TokenId.of(lastId.incrementAndGet());
        owners.put(id, owner);
        return id;
    }

    @Override
    public Optional<Address> ownerOf(TokenId tokenId) {
        return Optional.ofNullable(owners.get(tokenId));
    }

    @Override
    public void burn(TokenId tokenId) {
        owners.remove(tokenId);
    }

    /**
     * Move the token to another holder.
     *
     * @return false if the token does not exist or is not held by {@code from}
     */
    public boolean transfer(TokenId tokenId, Address from, Address to) {
        if (to == null)
            return false;
        return owners.replace(tokenId, from, to);
    }

    public long balanceOf(Address owner) {
        return owners.values().stream().filter(owner::equals).count();
    }

    public int totalSupply() {
        return owners.size();
    }

    /**
     * @return the last allocated id, 0 if nothing was minted yet
     */
    public long getLastTokenId() {
        return lastId.get();
    }
}
