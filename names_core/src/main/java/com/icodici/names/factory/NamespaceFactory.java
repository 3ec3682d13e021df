package com.icodici.names.factory;

import com.icodici.names.Address;
import com.icodici.names.Decimal;
import com.icodici.names.Errors;
import com.icodici.names.NamesConfig;
import com.icodici.names.events.NamespaceDeployed;
import com.icodici.names.exception.NameServiceError;
import com.icodici.names.registry.NameCanonicalizer;
import com.icodici.names.registry.ReentrancyGuard;
import com.icodici.names.registry.Registry;
import com.icodici.names.services.TokenLedger;
import com.icodici.names.services.TokenLedgerProvider;
import com.icodici.names.services.Treasury;
import com.icodici.names.tools.BufferedLogger;
import com.icodici.names.tools.Informer;
import com.icodici.names.tools.Reporter;
import com.icodici.names.tools.VerboseLevel;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deploys namespaces, one {@link Registry} per label, for a flat fee. All namespaces share the address book, the
 * record ledger and the fee receiver of the {@link FactoryConfig} that was current when they were deployed, and
 * start with the price tiers and expiration period of the {@link NamesConfig}.
 * <p>
 * Like the registries, the factory takes its guard inside a treasury transaction.
 */
public class NamespaceFactory {

    private final Address address;
    private final NamesConfig settings;
    private final Treasury treasury;
    private final TokenLedgerProvider tokenLedgerProvider;
    private final Clock clock;
    private final Informer informer;
    private final BufferedLogger logger;
    private final Reporter reporter;
    private final ReentrancyGuard guard = new ReentrancyGuard("namespace factory");

    private final Map<String, Registry> registries = new ConcurrentHashMap<>();
    private volatile FactoryConfig config;
    private volatile Address admin;

    /**
     * @param address             of the factory account, where fees are paid to
     * @param admin               who may change the configuration
     * @param config              initial configuration
     * @param settings            price tiers, expiration period and verbose level for the deployed namespaces
     * @param treasury            to move fees
     * @param tokenLedgerProvider creates token ledgers for new namespaces
     * @param clock               time source for the factory and its namespaces
     * @param informer            receives the events of the factory and its namespaces. If it has no exception
     *                            listener, the factory installs one that logs subscriber failures
     * @param logger              shared by the factory and its namespaces
     */
    public NamespaceFactory(Address address, Address admin, FactoryConfig config, NamesConfig settings,
                            Treasury treasury, TokenLedgerProvider tokenLedgerProvider, Clock clock,
                            Informer informer, BufferedLogger logger) {
        if (address == null || admin == null || config == null || settings == null || treasury == null
                || tokenLedgerProvider == null || clock == null || informer == null || logger == null)
            throw new IllegalArgumentException("namespace factory is not fully wired");
        this.address = address;
        this.admin = admin;
        this.config = config;
        this.settings = settings;
        this.treasury = treasury;
        this.tokenLedgerProvider = tokenLedgerProvider;
        this.clock = clock;
        this.informer = informer;
        this.logger = logger;
        reporter = new Reporter("factory: ", logger, settings.getVerboseLevel());
        informer.setExceptionListenerIfAbsent(x -> reporter.error(
                "SUBSCRIBER_FAILED", x.getEvent().getClass().getSimpleName(), String.valueOf(x.getException())));
    }

    /**
     * Deploy a namespace under a new label. The payment must be exactly the configured fee; it is forwarded to the
     * fee receiver. The caller becomes the namespace admin.
     *
     * @param name   of the namespace token ledger
     * @param symbol of the namespace token ledger
     * @param label  namespace label, like {@code eth}
     *
     * @return the new registry
     *
     * @throws NameServiceError {@link Errors#LABEL_TAKEN}, {@link Errors#WRONG_FEE}, {@link Errors#TRANSFER_FAILED}
     *                          or {@link Errors#BAD_VALUE}
     */
    public Registry deployNamespace(String name, String symbol, String label, Decimal payment, Address caller)
            throws NameServiceError {
        return mutate("deployNamespace", () -> {
            if (caller == null)
                throw new NameServiceError(Errors.BAD_VALUE, "caller", "caller address is required");
            String canonical = NameCanonicalizer.canonical(label);
            if (canonical.indexOf('.') >= 0)
                throw new NameServiceError(Errors.BAD_VALUE, "label", "label can't contain a dot: " + label);
            if (name == null || name.isEmpty() || symbol == null || symbol.isEmpty())
                throw new NameServiceError(Errors.BAD_VALUE, "name", "token name and symbol are required");
            if (registries.containsKey(canonical))
                throw new NameServiceError(Errors.LABEL_TAKEN, canonical, "namespace is already deployed");
            FactoryConfig current = config;
            if (payment == null || payment.compareTo(current.getFee()) != 0)
                throw new NameServiceError(Errors.WRONG_FEE, "payment",
                                           "fee is exactly " + current.getFee() + ", got " + payment);

            TokenLedger tokens = tokenLedgerProvider.create(name, symbol);
            Registry registry = Registry.builder()
                    .label(canonical)
                    .address(Address.derived(address, canonical))
                    .admin(address)
                    .tokenLedger(tokens)
                    .addressBook(current.getAddressBook())
                    .treasury(treasury)
                    .recordLedger(current.getRecordLedger())
                    .feeReceiver(current.getFeeReceiver())
                    .priceTiers(settings.getPriceTiers())
                    .expirationPeriod(settings.getExpirationPeriod())
                    .clock(clock)
                    .informer(informer)
                    .logger(logger, settings.getVerboseLevel())
                    .build();
            treasury.transaction(() -> {
                if (!treasury.transfer(caller, address, payment))
                    throw new NameServiceError(Errors.TRANSFER_FAILED, "payment",
                                               "can't collect " + payment + " from " + caller);
                if (!treasury.transfer(address, current.getFeeReceiver(), payment))
                    throw new NameServiceError(Errors.TRANSFER_FAILED, "fee",
                                               "can't forward " + payment + " to " + current.getFeeReceiver());
                return null;
            });

            registry.transferAdmin(caller, address);
            registries.put(canonical, registry);

            reporter.report(() -> Reporter.concat("deployed ", canonical, " at ", registry.getAddress(), " for ",
                                                  caller), VerboseLevel.BASE);
            informer.post(new NamespaceDeployed(canonical, name, symbol, registry.getAddress(), caller, payment,
                                                ZonedDateTime.now(clock)));
            return registry;
        });
    }

    /**
     * Send everything the factory account holds to the fee receiver.
     *
     * @return amount sent, may be zero
     *
     * @throws NameServiceError {@link Errors#UNAUTHORIZED} if the caller is not the fee receiver
     */
    public Decimal withdraw(Address caller) throws NameServiceError {
        return mutate("withdraw", () -> {
            Address receiver = config.getFeeReceiver();
            if (caller == null || !caller.equals(receiver))
                throw new NameServiceError(Errors.UNAUTHORIZED, "caller", caller + " is not the fee receiver");
            return treasury.transaction(() -> {
                Decimal amount = treasury.balanceOf(address);
                if (amount.isPositive() && !treasury.transfer(address, receiver, amount))
                    throw new NameServiceError(Errors.TRANSFER_FAILED, "withdraw",
                                               "can't send " + amount + " to " + receiver);
                reporter.report(() -> Reporter.concat("withdrawn ", amount, " to ", receiver), VerboseLevel.BASE);
                return amount;
            });
        });
    }

    /**
     * Replace the configuration. Namespaces deployed before keep the old one.
     */
    public void setConfig(FactoryConfig newConfig, Address caller) throws NameServiceError {
        mutate("setConfig", () -> {
            requireAdmin(caller);
            if (newConfig == null)
                throw new NameServiceError(Errors.BAD_VALUE, "config", "configuration is required");
            config = newConfig;
            reporter.report(() -> Reporter.concat("new configuration ", newConfig), VerboseLevel.BASE);
            return null;
        });
    }

    public void transferAdmin(Address newAdmin, Address caller) throws NameServiceError {
        mutate("transferAdmin", () -> {
            requireAdmin(caller);
            if (newAdmin == null)
                throw new NameServiceError(Errors.BAD_VALUE, "admin", "new admin address is required");
            admin = newAdmin;
            reporter.report(() -> Reporter.concat("admin is now ", newAdmin), VerboseLevel.BASE);
            return null;
        });
    }

    public Optional<Registry> getNamespaceHandle(String label) throws NameServiceError {
        return Optional.ofNullable(registries.get(NameCanonicalizer.canonical(label)));
    }

    /**
     * @return labels in alphabetical order
     */
    public List<String> getDeployedLabels() {
        List<String> labels = new ArrayList<>(registries.keySet());
        Collections.sort(labels);
        return labels;
    }

    public FactoryConfig getConfig() {
        return config;
    }

    public Address getAddress() {
        return address;
    }

    public Address getAdmin() {
        return admin;
    }

    private void requireAdmin(Address caller) throws NameServiceError {
        if (caller == null || !caller.equals(admin))
            throw new NameServiceError(Errors.UNAUTHORIZED, "caller", caller + " is not the factory admin");
    }

    private <T> T mutate(String operation, ReentrancyGuard.Action<T> action) throws NameServiceError {
        try {
            return treasury.transaction(() -> guard.synchronize(operation, action));
        } catch (NameServiceError e) {
            reporter.report(() -> Reporter.concat(operation, " rejected: ", e.getErrorRecord()),
                            VerboseLevel.DETAILED);
            throw e;
        }
    }
}
