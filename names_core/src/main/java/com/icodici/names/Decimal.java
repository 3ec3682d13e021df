/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>
 *
 */

package com.icodici.names;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Amount of value: fees, prices, payments and balances. Up to 18 decimal points in fractional part, half-up rounding,
 * no limits in integral part. Two amounts are equal when they are numerically equal, whatever their scale is.
 */
public final class Decimal extends Number implements Comparable<Decimal> {

    static public final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    static public final Decimal ZERO = new Decimal(0);
    static public final Decimal ONE = new Decimal(1);

    private final BigDecimal value;

    public Decimal(String stringValue) {
        this(new BigDecimal(stringValue));
    }

    public Decimal(long longValue) {
        this(new BigDecimal(longValue));
    }

    public Decimal(BigDecimal bigDecimalValue) {
        if (bigDecimalValue.scale() > SCALE)
            bigDecimalValue = bigDecimalValue.setScale(SCALE, ROUNDING);
        value = bigDecimalValue;
    }

    public static Decimal valueOf(long value) {
        return new Decimal(value);
    }

    public Decimal add(Decimal augend) {
        return new Decimal(value.add(augend.value));
    }

    public Decimal subtract(Decimal subtrahend) {
        return new Decimal(value.subtract(subtrahend.value));
    }

    public int signum() {
        return value.signum();
    }

    public boolean isPositive() {
        return value.signum() > 0;
    }

    public boolean isNegative() {
        return value.signum() < 0;
    }

    public BigDecimal toBigDecimal() {
        return value;
    }

    @Override
    public int compareTo(Decimal other) {
        return value.compareTo(other.value);
    }

    @Override
    public int intValue() {
        return value.intValue();
    }

    @Override
    public long longValue() {
        return value.longValue();
    }

    @Override
    public float floatValue() {
        return value.floatValue();
    }

    @Override
    public double doubleValue() {
        return value.doubleValue();
    }

    @Override
    public boolean equals(Object x) {
        if (x instanceof Decimal)
            return value.compareTo(((Decimal) x).value) == 0;
        if (x instanceof BigDecimal)
            return value.compareTo((BigDecimal) x) == 0;
        return false;
    }

    @Override
    public int hashCode() {
        return value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return value.toPlainString();
    }
}
