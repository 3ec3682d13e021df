package com.icodici.names.services;

import com.icodici.names.Address;
import com.icodici.names.NameHash;

/**
 * Maps owner identities to their names and to the one name each owner shows as primary.
 */
public interface ResolverAddressBook {

    void linkNameToOwner(NameHash nameHash, Address owner);

    void setPrimaryName(Address owner, NameHash nameHash);
}
