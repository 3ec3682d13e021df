package com.icodici.names.registry;

import com.icodici.names.Decimal;
import com.icodici.names.Errors;
import com.icodici.names.exception.NameServiceError;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Name length to price mapping, a short list of tiers searched by exact length. Lengths without a tier have no price
 * at all.
 */
public class PriceTable {

    private final List<PriceTier> tiers = new ArrayList<>();

    public PriceTable() {
    }

    public PriceTable(Collection<PriceTier> initialTiers) {
        for (PriceTier t : initialTiers)
            upsert(t);
    }

    /**
     * @throws NameServiceError with {@link Errors#INVALID_LENGTH} if there is no tier for the length
     */
    public synchronized Decimal priceFor(int length) throws NameServiceError {
        for (PriceTier t : tiers) {
            if (t.getLength() == length)
                return t.getPrice();
        }
        throw new NameServiceError(Errors.INVALID_LENGTH, "length", "no price for names of length " + length);
    }

    /**
     * Replace the price of an existing tier or append a new one.
     *
     * @throws NameServiceError with {@link Errors#BAD_VALUE} if length is not positive or price is negative
     */
    public void upsert(int length, Decimal price) throws NameServiceError {
        if (length <= 0)
            throw new NameServiceError(Errors.BAD_VALUE, "length", "length must be positive: " + length);
        if (price == null || price.isNegative())
            throw new NameServiceError(Errors.BAD_VALUE, "price", "price can't be negative: " + price);
        upsert(new PriceTier(length, price));
    }

    private synchronized void upsert(PriceTier tier) {
        for (int i = 0; i < tiers.size(); i++) {
            if (tiers.get(i).getLength() == tier.getLength()) {
                tiers.set(i, tier);
                return;
            }
        }
        tiers.add(tier);
    }

    /**
     * @return snapshot of the tiers in the order they were first added
     */
    public synchronized List<PriceTier> getTiers() {
        return Collections.unmodifiableList(new ArrayList<>(tiers));
    }

    public synchronized int size() {
        return tiers.size();
    }
}
