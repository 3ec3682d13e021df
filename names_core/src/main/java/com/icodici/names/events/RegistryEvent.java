package com.icodici.names.events;

import com.icodici.names.NameHash;

import java.time.ZonedDateTime;

/**
 * Base of the events a namespace registry posts after a committed change of a name.
 */
public abstract class RegistryEvent {

    private final String namespace;
    private final String name;
    private final NameHash nameHash;
    private final ZonedDateTime timestamp;

    protected RegistryEvent(String namespace, String name, NameHash nameHash, ZonedDateTime timestamp) {
        this.namespace = namespace;
        this.name = name;
        this.nameHash = nameHash;
        this.timestamp = timestamp;
    }

    /**
     * Label of the namespace the name lives in.
     */
    public String getNamespace() {
        return namespace;
    }

    /**
     * Canonical name (the sub-name only, for sub-name events).
     */
    public String getName() {
        return name;
    }

    public NameHash getNameHash() {
        return nameHash;
    }

    public ZonedDateTime getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + "." + namespace + " " + nameHash + ")";
    }
}
