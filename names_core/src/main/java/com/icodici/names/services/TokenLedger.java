package com.icodici.names.services;

import com.icodici.names.Address;
import com.icodici.names.TokenId;

import java.util.Optional;

/**
 * Non-fungible ownership tokens of one namespace. The holder of a token is the authoritative owner of the name bound
 * to it.
 */
public interface TokenLedger {

    /**
     * Collection name, as given at namespace deployment.
     */
    String getName();

    String getSymbol();

    /**
     * Allocate a new token for the owner. Ids grow monotonically starting from 1 and are never reused.
     *
     * @param owner who receives the token
     *
     * @return new token id
     */
    TokenId mint(Address owner);

    /**
     * @return current holder, or empty if the token does not exist or was burned
     */
    Optional<Address> ownerOf(TokenId tokenId);

    /**
     * Destroy the token. Burning a token that does not exist does nothing.
     */
    void burn(TokenId tokenId);
}
