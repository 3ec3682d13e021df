package com.icodici.names.events;

import com.icodici.names.Address;
import com.icodici.names.NameHash;

import java.time.ZonedDateTime;

public class PrimaryDomainSet extends RegistryEvent {

    private final Address owner;

    public PrimaryDomainSet(String namespace, String name, NameHash nameHash, Address owner, ZonedDateTime at) {
        super(namespace, name, nameHash, at);
        this.owner = owner;
    }

    public Address getOwner() {
        return owner;
    }
}
