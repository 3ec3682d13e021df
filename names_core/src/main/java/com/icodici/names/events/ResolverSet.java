package com.icodici.names.events;

import com.icodici.names.Address;
import com.icodici.names.NameHash;

import java.time.ZonedDateTime;

public class ResolverSet extends RegistryEvent {

    private final Address resolver;

    public ResolverSet(String namespace, String name, NameHash nameHash, Address resolver, ZonedDateTime at) {
        super(namespace, name, nameHash, at);
        this.resolver = resolver;
    }

    public Address getResolver() {
        return resolver;
    }
}
