package com.icodici.names.services;

import com.icodici.names.Address;
import com.icodici.names.NameHash;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory {@link ResolverAddressBook}, shared by all namespaces of a factory.
 */
public class SimpleAddressBook implements ResolverAddressBook {

    private final Map<NameHash, Address> linkedOwners = new ConcurrentHashMap<>();
    private final Map<Address, NameHash> primaryNames = new ConcurrentHashMap<>();

    @Override
    public void linkNameToOwner(NameHash nameHash, Address owner) {
        linkedOwners.put(nameHash, owner);
    }

    @Override
    public void setPrimaryName(Address owner, NameHash nameHash) {
        primaryNames.put(owner, nameHash);
    }

    public Optional<Address> getLinkedOwner(NameHash nameHash) {
        return Optional.ofNullable(linkedOwners.get(nameHash));
    }

    public Optional<NameHash> getPrimaryName(Address owner) {
        return Optional.ofNullable(primaryNames.get(owner));
    }

    public List<NameHash> getLinkedNames(Address owner) {
        return linkedOwners.entrySet().stream()
                .filter(e -> e.getValue().equals(owner))
                .map(Map.Entry::getKey)
                .sorted()
                .collect(Collectors.toList());
    }
}
