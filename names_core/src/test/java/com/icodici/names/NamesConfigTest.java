package com.icodici.names;

import com.icodici.names.registry.PriceTier;
import com.icodici.names.tools.BufferedLogger;
import com.icodici.names.tools.VerboseLevel;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.junit.Assert.*;

public class NamesConfigTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void defaults() throws Exception {
        NamesConfig config = NamesConfig.defaults();
        assertEquals(Duration.ofDays(365), config.getExpirationPeriod());
        assertEquals(new Decimal(100), config.getNamespaceFee());
        assertEquals(VerboseLevel.BASE, config.getVerboseLevel());
        assertEquals(1000, config.getLogBufferSize());
        List<PriceTier> tiers = config.getPriceTiers();
        assertEquals(8, tiers.size());
        assertEquals(new PriceTier(3, new Decimal(640)), tiers.get(0));
    }

    @Test
    public void fromTestResource() throws Exception {
        NamesConfig config;
        try (InputStream in = getClass().getResourceAsStream("/test_names.yaml")) {
            config = NamesConfig.fromYaml(in);
        }
        assertEquals(Duration.ofDays(30), config.getExpirationPeriod());
        assertEquals(new Decimal("0.5"), config.getNamespaceFee());
        assertEquals(VerboseLevel.DETAILED, config.getVerboseLevel());
        assertEquals(200, config.getLogBufferSize());
        assertEquals(new PriceTier(4, new Decimal(5)), config.getPriceTiers().get(1));
    }

    @Test
    public void optionalKeys() throws Exception {
        NamesConfig config = NamesConfig.fromYaml(yaml("expiration_days: 1\nnamespace_fee: 0\nverbose_level: 0\n"));
        assertEquals(VerboseLevel.NOTHING, config.getVerboseLevel());
        assertTrue(config.getPriceTiers().isEmpty());
        assertEquals(1000, config.getLogBufferSize());
    }

    @Test
    public void missingKeys() throws Exception {
        try {
            NamesConfig.fromYaml(yaml("namespace_fee: 1\n"));
            fail("must throw");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("expiration_days"));
        }
        try {
            NamesConfig.fromYaml(yaml("expiration_days: 10\n"));
            fail("must throw");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("namespace_fee"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void badTier() throws Exception {
        NamesConfig.fromYaml(yaml("expiration_days: 10\nnamespace_fee: 1\nprices:\n  - {length: 0, price: 1}\n"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void badVerboseLevel() throws Exception {
        NamesConfig.fromYaml(yaml("expiration_days: 10\nnamespace_fee: 1\nverbose_level: loud\n"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void badExpiration() throws Exception {
        NamesConfig.fromYaml(yaml("expiration_days: 0\nnamespace_fee: 1\n"));
    }

    @Test
    public void loggerKeepsConfiguredNumberOfEntries() throws Exception {
        NamesConfig config = NamesConfig.fromYaml(yaml("expiration_days: 1\nnamespace_fee: 0\nlog_buffer: 3\n"));
        try (BufferedLogger logger = config.createLogger()) {
            for (int i = 0; i < 5; i++)
                logger.log("line " + i);
            assertTrue(logger.flush(2000));
            List<BufferedLogger.Entry> entries = logger.getCopy();
            assertEquals(3, entries.size());
            assertEquals("line 2", entries.get(0).message);
        }
    }
}
