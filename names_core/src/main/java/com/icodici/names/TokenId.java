package com.icodici.names;

/**
 * Ownership token identifier. Always positive: "no token" is expressed with an empty {@link java.util.Optional},
 * never with a zero id.
 */
public final class TokenId implements Comparable<TokenId> {

    private final long value;

    private TokenId(long value) {
        this.value = value;
    }

    public static TokenId of(long value) {
        if (value <= 0)
            throw new IllegalArgumentException("token id must be positive: " + value);
        return new TokenId(value);
    }

    public long longValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TokenId && ((TokenId) obj).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public int compareTo(TokenId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
