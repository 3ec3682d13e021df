package com.icodici.names.registry;

import com.icodici.names.Decimal;
import com.icodici.names.Errors;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static com.icodici.names.ErrorAssert.assertError;
import static org.junit.Assert.assertEquals;

public class PriceTableTest {

    private PriceTable table;

    @Before
    public void setUp() {
        table = new PriceTable(Arrays.asList(
                new PriceTier(3, new Decimal(10)),
                new PriceTier(4, new Decimal(5)),
                new PriceTier(5, new Decimal(3))));
    }

    @Test
    public void priceFor() throws Exception {
        assertEquals(new Decimal(10), table.priceFor(3));
        assertEquals(new Decimal(5), table.priceFor(4));
        assertEquals(new Decimal(3), table.priceFor(5));
        assertError(Errors.INVALID_LENGTH, () -> table.priceFor(2));
        assertError(Errors.INVALID_LENGTH, () -> table.priceFor(6));
    }

    @Test
    public void upsert() throws Exception {
        table.upsert(4, new Decimal(7));
        assertEquals(new Decimal(7), table.priceFor(4));
        assertEquals(3, table.size());

        table.upsert(6, new Decimal("0.5"));
        assertEquals(new Decimal("0.5"), table.priceFor(6));
        assertEquals(4, table.size());
        assertEquals(6, table.getTiers().get(3).getLength());
        assertEquals(4, table.getTiers().get(1).getLength());

        table.upsert(6, new Decimal("0.5"));
        assertEquals(4, table.size());
    }

    @Test
    public void badTiers() throws Exception {
        assertError(Errors.BAD_VALUE, () -> table.upsert(0, Decimal.ONE));
        assertError(Errors.BAD_VALUE, () -> table.upsert(-1, Decimal.ONE));
        assertError(Errors.BAD_VALUE, () -> table.upsert(3, new Decimal(-1)));
        assertEquals(new Decimal(10), table.priceFor(3));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void tiersSnapshotIsReadOnly() throws Exception {
        table.getTiers().clear();
    }

    @Test
    public void freeTier() throws Exception {
        table.upsert(7, Decimal.ZERO);
        assertEquals(Decimal.ZERO, table.priceFor(7));
    }
}
