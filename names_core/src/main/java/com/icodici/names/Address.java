package com.icodici.names;

import org.checkerframework.checker.nullness.qual.NonNull;

/**
 * Address-like identity of a party: a name owner, a resolver target, a fee receiver, a registry or factory handle.
 * Compared by exact (case-sensitive) value.
 */
public final class Address implements Comparable<Address> {

    private final String value;

    private Address(String value) {
        this.value = value;
    }

    public static @NonNull Address of(String value) {
        if (value == null || value.trim().isEmpty())
            throw new IllegalArgumentException("address can't be empty");
        return new Address(value.trim());
    }

    /**
     * Address of something spawned by the parent, for example a registry deployed by a factory.
     */
    public static @NonNull Address derived(Address parent, String tag) {
        return new Address(parent.value + "/" + tag);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Address && value.equals(((Address) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public int compareTo(Address other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
