package com.icodici.names.registry;

import com.icodici.names.Address;
import com.icodici.names.NameHash;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * State of a registered name. The resolver is where the name points to; it starts as the registrant but has nothing
 * to do with ownership, which is the ownership token. Immutable: changes produce a new record.
 */
public final class DomainRecord {

    private final Address resolver;
    private final ZonedDateTime expiresAt;
    private final String name;
    private final NameHash parent;

    public DomainRecord(@NonNull Address resolver, @NonNull ZonedDateTime expiresAt, @NonNull String name,
                        @Nullable NameHash parent) {
        this.resolver = resolver;
        this.expiresAt = expiresAt;
        this.name = name;
        this.parent = parent;
    }

    public Address getResolver() {
        return resolver;
    }

    public ZonedDateTime getExpiresAt() {
        return expiresAt;
    }

    /**
     * Canonical name, without the namespace or the parent.
     */
    public String getName() {
        return name;
    }

    /**
     * @return hash of the parent name or null for a top-level name
     */
    public @Nullable NameHash getParent() {
        return parent;
    }

    public boolean isSubDomain() {
        return parent != null;
    }

    public boolean isExpiredAt(ZonedDateTime moment) {
        return !expiresAt.isAfter(moment);
    }

    public DomainRecord withResolver(Address newResolver) {
        return new DomainRecord(newResolver, expiresAt, name, parent);
    }

    public DomainRecord withExpiresAt(ZonedDateTime newExpiresAt) {
        return new DomainRecord(resolver, newExpiresAt, name, parent);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DomainRecord))
            return false;
        DomainRecord r = (DomainRecord) o;
        return resolver.equals(r.resolver) && expiresAt.equals(r.expiresAt) && name.equals(r.name)
                && Objects.equals(parent, r.parent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resolver, expiresAt, name, parent);
    }

    @Override
    public String toString() {
        return "DomainRecord(" + name + " -> " + resolver + " until " + expiresAt + ")";
    }
}
