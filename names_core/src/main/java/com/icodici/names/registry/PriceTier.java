package com.icodici.names.registry;

import com.icodici.names.Decimal;
import com.icodici.names.tools.Binder;

import java.util.Objects;

/**
 * Price of every name of the given length.
 */
public final class PriceTier {

    private final int length;
    private final Decimal price;

    public PriceTier(int length, Decimal price) {
        if (length <= 0)
            throw new IllegalArgumentException("tier length must be positive: " + length);
        if (price == null || price.isNegative())
            throw new IllegalArgumentException("tier price can't be negative: " + price);
        this.length = length;
        this.price = price;
    }

    /**
     * Read a tier from settings like <code>{length: 4, price: 5}</code>.
     */
    public static PriceTier fromBinder(Binder b) {
        return new PriceTier(b.getIntOrThrow("length"), new Decimal(b.getBigDecimalOrThrow("price")));
    }

    public int getLength() {
        return length;
    }

    public Decimal getPrice() {
        return price;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof PriceTier))
            return false;
        PriceTier other = (PriceTier) o;
        return length == other.length && price.equals(other.price);
    }

    @Override
    public int hashCode() {
        return Objects.hash(length, price);
    }

    @Override
    public String toString() {
        return length + ":" + price;
    }
}
