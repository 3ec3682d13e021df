package com.icodici.names;

import com.icodici.names.registry.PriceTier;
import com.icodici.names.tools.Binder;
import com.icodici.names.tools.BufferedLogger;
import com.icodici.names.tools.VerboseLevel;
import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings shared by a factory and every namespace it deploys, read from YAML:
 * <pre>
 * expiration_days: 365
 * namespace_fee: 100
 * verbose_level: base
 * log_buffer: 1000
 * prices:
 *   - {length: 3, price: 10}
 *   - {length: 4, price: 5}
 * </pre>
 */
public class NamesConfig {

    public static final String DEFAULTS_RESOURCE = "/names.yaml";

    private Duration expirationPeriod;
    private Decimal namespaceFee;
    private List<PriceTier> priceTiers = new ArrayList<>();
    private int verboseLevel = VerboseLevel.BASE;
    private int logBufferSize = 1000;

    public NamesConfig() {
    }

    public static NamesConfig load(String path) throws IOException {
        try (InputStream in = new FileInputStream(path)) {
            return fromYaml(in);
        }
    }

    /**
     * Settings bundled with the library.
     */
    public static NamesConfig defaults() throws IOException {
        try (InputStream in = NamesConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null)
                throw new IOException("resource not found: " + DEFAULTS_RESOURCE);
            return fromYaml(in);
        }
    }

    /**
     * @throws IllegalArgumentException if a required key is missing or malformed
     */
    public static NamesConfig fromYaml(InputStream in) {
        Yaml yaml = new Yaml();
        return fromBinder(Binder.from(yaml.load(in)));
    }

    public static NamesConfig fromBinder(Binder settings) {
        NamesConfig config = new NamesConfig();
        long days = settings.getLongOrThrow("expiration_days");
        if (days <= 0)
            throw new IllegalArgumentException("expiration_days must be positive: " + days);
        config.expirationPeriod = Duration.ofDays(days);
        config.namespaceFee = new Decimal(settings.getBigDecimalOrThrow("namespace_fee"));
        if (config.namespaceFee.isNegative())
            throw new IllegalArgumentException("namespace_fee can't be negative");
        for (Binder b : settings.getBinders("prices"))
            config.priceTiers.add(PriceTier.fromBinder(b));
        Object level = settings.get("verbose_level");
        if (level instanceof Number)
            config.verboseLevel = ((Number) level).intValue();
        else if (level != null)
            config.verboseLevel = VerboseLevel.stringToInt(level.toString());
        config.logBufferSize = settings.getInt("log_buffer", config.logBufferSize);
        if (config.logBufferSize < 1)
            throw new IllegalArgumentException("log_buffer must be positive");
        return config;
    }

    public Duration getExpirationPeriod() {
        return expirationPeriod;
    }

    public NamesConfig setExpirationPeriod(Duration expirationPeriod) {
        this.expirationPeriod = expirationPeriod;
        return this;
    }

    public Decimal getNamespaceFee() {
        return namespaceFee;
    }

    public NamesConfig setNamespaceFee(Decimal namespaceFee) {
        this.namespaceFee = namespaceFee;
        return this;
    }

    /**
     * Tiers every new namespace starts with.
     */
    public List<PriceTier> getPriceTiers() {
        return Collections.unmodifiableList(priceTiers);
    }

    public NamesConfig setPriceTiers(List<PriceTier> tiers) {
        this.priceTiers = new ArrayList<>(tiers);
        return this;
    }

    public int getVerboseLevel() {
        return verboseLevel;
    }

    public NamesConfig setVerboseLevel(int verboseLevel) {
        this.verboseLevel = verboseLevel;
        return this;
    }

    public int getLogBufferSize() {
        return logBufferSize;
    }

    /**
     * @return new logger keeping up to {@code log_buffer} entries in memory
     */
    public BufferedLogger createLogger() {
        return new BufferedLogger(logBufferSize);
    }

    @Override
    public String toString() {
        return "NamesConfig(expiration=" + expirationPeriod + ", fee=" + namespaceFee + ", prices=" + priceTiers
                + ", verbose=" + VerboseLevel.intToString(verboseLevel) + ")";
    }
}
