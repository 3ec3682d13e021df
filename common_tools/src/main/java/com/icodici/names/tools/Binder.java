/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.names.tools;

import org.checkerframework.checker.nullness.qual.NonNull;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * String-keyed map with typed accessors, used to carry loosely-typed data such as parsed YAML settings. The
 * {@code ...OrThrow} family reports missing keys with {@link IllegalArgumentException}, the rest return a supplied
 * default.
 */
public class Binder extends HashMap<String, Object> {

    /**
     * An empty, unmodifiable Binder.
     */
    public static final Binder EMPTY;

    static {
        EMPTY = new Binder();
        EMPTY.freeze();
    }

    private boolean frozen = false;

    public Binder() {
    }

    public Binder(Map<String, ?> copyFrom) {
        super(copyFrom);
    }

    /**
     * Convert "key, value" pairs from varargs into a Binder.
     *
     * @param keysValues key, value pairs. Can be 0 length or any even length.
     *
     * @return filled instance
     */
    static public Binder fromKeysValues(Object... keysValues) {
        if ((keysValues.length & 1) == 1)
            throw new IllegalArgumentException("keysValues should be even sized array");
        Binder b = new Binder();
        for (int i = 0; i < keysValues.length; i += 2)
            b.put(keysValues[i].toString(), keysValues[i + 1]);
        return b;
    }

    /**
     * Convert some map to the binder. Do nothing if it is already a binder.
     *
     * @param x source map
     */
    @SuppressWarnings("unchecked")
    static public Binder from(Object x) {
        if (x instanceof Binder)
            return (Binder) x;
        if (x == null)
            return new Binder();
        if (!(x instanceof Map))
            throw new IllegalArgumentException("can't convert to binder: " + x.getClass().getCanonicalName());
        return new Binder((Map<String, ?>) x);
    }

    public boolean isFrozen() {
        return frozen;
    }

    public void freeze() {
        frozen = true;
    }

    protected void checkNotFrozen() {
        if (frozen)
            throw new IllegalStateException("attempt to modify a frozen binder");
    }

    @Override
    public Object put(String key, Object value) {
        checkNotFrozen();
        return super.put(key, value);
    }

    public Binder set(String key, Object value) {
        put(key, value);
        return this;
    }

    /**
     * Get the parameter as string. Throws exception if it is missing.
     *
     * @throws IllegalArgumentException if the parameter does not exist
     */
    public @NonNull String getStringOrThrow(String key) throws IllegalArgumentException {
        Object object = get(key);
        if (object == null)
            throw new IllegalArgumentException("missing required parameter: " + key);
        return object.toString();
    }

    public String getString(String key, String defaultValue) {
        Object result = get(key);
        return result == null ? defaultValue : result.toString();
    }

    public int getIntOrThrow(String key) {
        return toNumber(key, get(key)).intValue();
    }

    public int getInt(String key, int defaultValue) {
        Object x = get(key);
        return x == null ? defaultValue : toNumber(key, x).intValue();
    }

    public long getLongOrThrow(String key) {
        return toNumber(key, get(key)).longValue();
    }

    public long getLong(String key, long defaultValue) {
        Object x = get(key);
        return x == null ? defaultValue : toNumber(key, x).longValue();
    }

    /**
     * Numbers are read through their string form so that YAML doubles like {@code 0.1} keep the value they were
     * written with.
     */
    public @NonNull BigDecimal getBigDecimalOrThrow(String key) {
        Object x = get(key);
        if (x == null)
            throw new IllegalArgumentException("missing required parameter: " + key);
        if (x instanceof BigDecimal)
            return (BigDecimal) x;
        try {
            return new BigDecimal(x.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number at key " + key + ": " + x);
        }
    }

    public Boolean getBoolean(String key, Boolean defaultValue) {
        Object x = get(key);
        if (x == null)
            return defaultValue;
        if (x instanceof Boolean)
            return (Boolean) x;
        return Boolean.valueOf(x.toString());
    }

    /**
     * Return Binder for the key, or empty binder if it does not exist. Frozen binders return frozen children.
     */
    public @NonNull Binder getBinder(String key) {
        Binder b = from(get(key));
        if (frozen)
            b.freeze();
        return b;
    }

    public @NonNull Binder getBinderOrThrow(String key) {
        if (get(key) == null)
            throw new IllegalArgumentException("map not found at key: " + key);
        return getBinder(key);
    }

    public @NonNull List<?> getList(String key) {
        Object x = get(key);
        if (x == null)
            return new ArrayList<>();
        if (x instanceof Collection)
            return new ArrayList<>((Collection<?>) x);
        if (x.getClass().isArray()) {
            ArrayList<Object> result = new ArrayList<>();
            for (Object item : (Object[]) x)
                result.add(item);
            return result;
        }
        throw new IllegalArgumentException("not a list at key " + key + ": " + x);
    }

    public @NonNull List<Binder> getBinders(String key) {
        ArrayList<Binder> result = new ArrayList<>();
        for (Object x : getList(key))
            result.add(from(x));
        return result;
    }

    public Binder unmodifiableCopy() {
        Binder b = new Binder(this);
        b.freeze();
        return b;
    }

    private static Number toNumber(String key, Object x) {
        if (x == null)
            throw new IllegalArgumentException("missing numeric parameter: " + key);
        if (x instanceof Number)
            return (Number) x;
        try {
            return Long.valueOf(x.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not an integer at key " + key + ": " + x);
        }
    }
}
