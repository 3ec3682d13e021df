package com.icodici.names.registry;

import com.icodici.names.Address;
import com.icodici.names.Decimal;
import com.icodici.names.Errors;
import com.icodici.names.NameHash;
import com.icodici.names.TokenId;
import com.icodici.names.events.DomainBurned;
import com.icodici.names.events.DomainRegistered;
import com.icodici.names.events.DomainRenewed;
import com.icodici.names.events.PrimaryDomainSet;
import com.icodici.names.events.ResolverSet;
import com.icodici.names.events.SubDomainCreated;
import com.icodici.names.exception.NameServiceError;
import com.icodici.names.ledger.RecordLedger;
import com.icodici.names.services.ResolverAddressBook;
import com.icodici.names.services.TokenLedger;
import com.icodici.names.services.Treasury;
import com.icodici.names.tools.BufferedLogger;
import com.icodici.names.tools.Informer;
import com.icodici.names.tools.Reporter;
import com.icodici.names.tools.VerboseLevel;
import org.checkerframework.checker.nullness.qual.NonNull;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Names of one namespace. A name is owned by whoever holds its ownership token in the namespace {@link TokenLedger};
 * its record keeps the resolver address and the expiration.
 * <p>
 * Every state-changing operation runs under the {@link ReentrancyGuard} and is all-or-nothing: payments are made in
 * one {@link Treasury#transaction(Treasury.Transactional)}, the token is minted inside it and burned again if the
 * address book refuses the link, and the record, the token maps and the {@link RecordLedger} are written only after
 * the money has settled. Events are posted after that, through the {@link Informer}. Subscriber exceptions are logged
 * as {@code SUBSCRIBER_FAILED} unless the informer already has its own exception listener.
 * <p>
 * The guard is always taken inside a treasury transaction. Receivers run while the treasury is locked, so a receiver
 * calling into another namespace takes the locks in the same order as any other caller.
 * <p>
 * Reads take no locks. Expired names keep their token and record: only {@link #resolve(String)} treats them as
 * absent.
 */
public class Registry {

    private final String label;
    private final Address address;
    private final TokenLedger tokens;
    private final ResolverAddressBook addressBook;
    private final Treasury treasury;
    private final RecordLedger recordLedger;
    private final Address feeReceiver;
    private final PriceTable prices;
    private final Duration expirationPeriod;
    private final Clock clock;
    private final Informer informer;
    private final Reporter reporter;
    private final ReentrancyGuard guard;

    private final Map<NameHash, DomainRecord> records = new ConcurrentHashMap<>();
    private final Map<NameHash, TokenId> tokenByHash = new ConcurrentHashMap<>();
    private final Map<TokenId, NameHash> hashByToken = new ConcurrentHashMap<>();
    private volatile Address admin;

    private Registry(Builder b) {
        label = b.label;
        address = b.address;
        admin = b.admin;
        tokens = b.tokens;
        addressBook = b.addressBook;
        treasury = b.treasury;
        recordLedger = b.recordLedger;
        feeReceiver = b.feeReceiver;
        prices = new PriceTable(b.priceTiers);
        expirationPeriod = b.expirationPeriod;
        clock = b.clock;
        reporter = new Reporter("ns(" + label + "): ", b.logger, b.verboseLevel);
        informer = b.informer != null ? b.informer : new Informer();
        informer.setExceptionListenerIfAbsent(this::reportSubscriberFailure);
        guard = new ReentrancyGuard("namespace " + label);
    }

    public static Builder builder() {
        return new Builder();
    }

    ////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
    // state-changing operations

    /**
     * Register a top-level name to the caller. Forwards exactly the price to the fee receiver and refunds the rest of
     * the payment. The caller also becomes the resolver.
     *
     * @return the ownership token of the new name
     *
     * @throws NameServiceError {@link Errors#ALREADY_REGISTERED}, {@link Errors#INVALID_LENGTH}, {@link
     *                          Errors#INSUFFICIENT_PAYMENT}, {@link Errors#TRANSFER_FAILED} or {@link
     *                          Errors#REENTRANCY_BLOCKED}
     */
    public @NonNull TokenId registerDomain(String name, Decimal payment, Address caller) throws NameServiceError {
        return mutate("registerDomain", () -> {
            String canonical = NameCanonicalizer.canonical(name);
            NameHash hash = NameHasher.hash(canonical, label);
            requireCaller(caller);
            if (tokenByHash.containsKey(hash))
                throw new NameServiceError(Errors.ALREADY_REGISTERED, canonical, "name is already registered");
            Decimal price = prices.priceFor(NameCanonicalizer.length(canonical));
            checkPayment(canonical, payment, price);

            ZonedDateTime now = now();
            ZonedDateTime expiresAt = now.plus(expirationPeriod);
            TokenId tokenId = treasury.transaction(() -> {
                collectPayment(caller, payment, price);
                return mintAndLink(hash, caller);
            });

            store(hash, tokenId, new DomainRecord(caller, expiresAt, canonical, null));
            recordLedger.append(fullName(canonical), caller, now, expiresAt, price, address);
            reporter.report(() -> Reporter.concat("registered ", fullName(canonical), " ", tokenId, " to ", caller,
                                                  " for ", price, " until ", expiresAt), VerboseLevel.BASE);
            informer.post(new DomainRegistered(label, canonical, hash, tokenId, caller, price, now, expiresAt));
            return tokenId;
        });
    }

    /**
     * Extend the name by one expiration period, counted from its current expiration even if it is already in the
     * past. Payment is processed as in {@link #registerDomain(String, Decimal, Address)}.
     *
     * @return new expiration
     */
    public @NonNull ZonedDateTime renewDomain(String name, Decimal payment, Address caller) throws NameServiceError {
        return mutate("renewDomain", () -> {
            String canonical = NameCanonicalizer.canonical(name);
            NameHash hash = NameHasher.hash(canonical, label);
            requireCaller(caller);
            DomainRecord record = requireHolder(hash, canonical, caller);
            Decimal price = prices.priceFor(NameCanonicalizer.length(canonical));
            checkPayment(canonical, payment, price);

            treasury.transaction(() -> {
                collectPayment(caller, payment, price);
                return null;
            });

            ZonedDateTime previous = record.getExpiresAt();
            ZonedDateTime expiresAt = previous.plus(expirationPeriod);
            records.put(hash, record.withExpiresAt(expiresAt));
            reporter.report(() -> Reporter.concat("renewed ", fullName(canonical), " until ", expiresAt, " for ",
                                                  price), VerboseLevel.BASE);
            informer.post(new DomainRenewed(label, canonical, hash, caller, price, now(), previous, expiresAt));
            return expiresAt;
        });
    }

    /**
     * Point the name to another address. Ownership does not change.
     */
    public void setResolver(String name, Address resolver, Address caller) throws NameServiceError {
        mutate("setResolver", () -> {
            String canonical = NameCanonicalizer.canonical(name);
            NameHash hash = NameHasher.hash(canonical, label);
            requireCaller(caller);
            if (resolver == null)
                throw new NameServiceError(Errors.BAD_VALUE, "resolver", "resolver address is required");
            DomainRecord record = requireHolder(hash, canonical, caller);
            records.put(hash, record.withResolver(resolver));
            reporter.report(() -> Reporter.concat(fullName(canonical), " resolves to ", resolver), VerboseLevel.BASE);
            informer.post(new ResolverSet(label, canonical, hash, resolver, now()));
            return null;
        });
    }

    /**
     * Make the name the primary (display) name of the caller in the resolver address book.
     */
    public void setPrimaryDomain(String name, Address caller) throws NameServiceError {
        mutate("setPrimaryDomain", () -> {
            String canonical = NameCanonicalizer.canonical(name);
            NameHash hash = NameHasher.hash(canonical, label);
            requireCaller(caller);
            requireHolder(hash, canonical, caller);
            addressBook.setPrimaryName(caller, hash);
            reporter.report(() -> Reporter.concat(fullName(canonical), " is primary for ", caller), VerboseLevel.BASE);
            informer.post(new PrimaryDomainSet(label, canonical, hash, caller, now()));
            return null;
        });
    }

    /**
     * Create a sub-name under a top-level name. Free of charge and not recorded in the {@link RecordLedger}.
     *
     * @param parentName top-level name the caller holds
     * @param subName    name to create under it
     * @param owner      who receives the new token and becomes the resolver
     * @param caller     the parent holder
     *
     * @return hash of the new sub-name, which can be used as a parent itself
     */
    public @NonNull NameHash createSubDomain(String parentName, String subName, Address owner, Address caller)
            throws NameServiceError {
        return createSubDomain(NameHasher.hash(parentName, label), subName, owner, caller);
    }

    /**
     * Create a sub-name under any registered name, top-level or not.
     *
     * @see #createSubDomain(String, String, Address, Address)
     */
    public @NonNull NameHash createSubDomain(NameHash parent, String subName, Address owner, Address caller)
            throws NameServiceError {
        return mutate("createSubDomain", () -> {
            requireCaller(caller);
            requireHash(parent);
            if (owner == null)
                throw new NameServiceError(Errors.BAD_VALUE, "owner", "sub-name owner is required");
            requireHolder(parent, String.valueOf(parent), caller);
            String canonical = NameCanonicalizer.canonical(subName);
            NameHash hash = NameHasher.subHash(parent, canonical);
            if (tokenByHash.containsKey(hash))
                throw new NameServiceError(Errors.ALREADY_REGISTERED, canonical, "sub-name is already registered");

            ZonedDateTime now = now();
            ZonedDateTime expiresAt = now.plus(expirationPeriod);
            TokenId tokenId = mintAndLink(hash, owner);
            store(hash, tokenId, new DomainRecord(owner, expiresAt, canonical, parent));
            reporter.report(() -> Reporter.concat("created sub-name ", canonical, " under ", parent, " ", tokenId,
                                                  " for ", owner), VerboseLevel.BASE);
            informer.post(new SubDomainCreated(label, canonical, hash, parent, tokenId, owner, now, expiresAt));
            return hash;
        });
    }

    /**
     * Administrative removal of a top-level name: its token is burned and its record forgotten, so the name can be
     * registered again. The {@link RecordLedger} history stays.
     */
    public void burnDomain(String name, Address caller) throws NameServiceError {
        burnDomain(NameHasher.hash(name, label), caller);
    }

    /**
     * Administrative removal of any name, sub-names included.
     */
    public void burnDomain(NameHash hash, Address caller) throws NameServiceError {
        mutate("burnDomain", () -> {
            requireAdmin(caller);
            requireHash(hash);
            TokenId tokenId = tokenByHash.get(hash);
            if (tokenId == null)
                throw new NameServiceError(Errors.NOT_FOUND, String.valueOf(hash), "name is not registered");
            DomainRecord record = records.get(hash);
            tokens.burn(tokenId);
            tokenByHash.remove(hash);
            hashByToken.remove(tokenId);
            records.remove(hash);
            String canonical = record != null ? record.getName() : String.valueOf(hash);
            reporter.report(() -> Reporter.concat("burned ", canonical, " ", tokenId), VerboseLevel.BASE);
            informer.post(new DomainBurned(label, canonical, hash, tokenId, now()));
            return null;
        });
    }

    /**
     * Set the price of names of the given length, adding the tier if it does not exist.
     */
    public void setPriceConfig(int length, Decimal price, Address caller) throws NameServiceError {
        mutate("setPriceConfig", () -> {
            requireAdmin(caller);
            prices.upsert(length, price);
            reporter.report(() -> Reporter.concat("price for length ", length, " is ", price), VerboseLevel.BASE);
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

    ////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
    // reads

    /**
     * @throws NameServiceError {@link Errors#INVALID_LENGTH} if names of this length have no price
     */
    public @NonNull Decimal getDomainPrice(String name) throws NameServiceError {
        return prices.priceFor(NameCanonicalizer.length(NameCanonicalizer.canonical(name)));
    }

    public @NonNull NameHash generateHash(String name) throws NameServiceError {
        return NameHasher.hash(name, label);
    }

    public @NonNull NameHash generateSubHash(NameHash parent, String subName) throws NameServiceError {
        return NameHasher.subHash(parent, subName);
    }

    public @NonNull ZonedDateTime getExpiration(String name) throws NameServiceError {
        return getDomainRecord(name).getExpiresAt();
    }

    public @NonNull Address getResolver(String name) throws NameServiceError {
        return getDomainRecord(name).getResolver();
    }

    /**
     * @throws NameServiceError {@link Errors#NOT_FOUND} if the name was never registered or was burned
     */
    public @NonNull DomainRecord getDomainRecord(String name) throws NameServiceError {
        return getRecord(NameHasher.hash(name, label));
    }

    public @NonNull DomainRecord getSubDomainRecord(NameHash parent, String subName) throws NameServiceError {
        return getRecord(NameHasher.subHash(parent, subName));
    }

    public @NonNull DomainRecord getRecord(NameHash hash) throws NameServiceError {
        requireHash(hash);
        DomainRecord record = records.get(hash);
        if (record == null)
            throw new NameServiceError(Errors.NOT_FOUND, String.valueOf(hash), "name is not registered");
        return record;
    }

    /**
     * Resolver of a name that is registered and not yet expired.
     */
    public Optional<Address> resolve(String name) throws NameServiceError {
        DomainRecord record = records.get(NameHasher.hash(name, label));
        if (record == null || record.isExpiredAt(now()))
            return Optional.empty();
        return Optional.of(record.getResolver());
    }

    /**
     * @return true if the caller holds the token of the name
     */
    public boolean checkOwnership(String name, Address caller) throws NameServiceError {
        return isHolder(NameHasher.hash(name, label), caller);
    }

    public boolean isHolder(NameHash hash, Address caller) {
        if (hash == null || caller == null)
            return false;
        TokenId tokenId = tokenByHash.get(hash);
        if (tokenId == null)
            return false;
        return tokens.ownerOf(tokenId).map(caller::equals).orElse(false);
    }

    public Optional<Address> ownerOf(String name) throws NameServiceError {
        TokenId tokenId = tokenByHash.get(NameHasher.hash(name, label));
        return tokenId == null ? Optional.empty() : tokens.ownerOf(tokenId);
    }

    public Optional<TokenId> getTokenId(String name) throws NameServiceError {
        return Optional.ofNullable(tokenByHash.get(NameHasher.hash(name, label)));
    }

    public Optional<NameHash> getNameHash(TokenId tokenId) {
        return tokenId == null ? Optional.empty() : Optional.ofNullable(hashByToken.get(tokenId));
    }

    public boolean isAvailable(String name) throws NameServiceError {
        return !tokenByHash.containsKey(NameHasher.hash(name, label));
    }

    public List<PriceTier> getPriceTiers() {
        return prices.getTiers();
    }

    /**
     * Canonical namespace label, like {@code eth}.
     */
    public String getLabel() {
        return label;
    }

    public Address getAddress() {
        return address;
    }

    public Address getAdmin() {
        return admin;
    }

    public Address getFeeReceiver() {
        return feeReceiver;
    }

    public Duration getExpirationPeriod() {
        return expirationPeriod;
    }

    public TokenLedger getTokenLedger() {
        return tokens;
    }

    public int size() {
        return records.size();
    }

    ////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
    // internals

    private void reportSubscriberFailure(Informer.ExceptionContext x) {
        reporter.error("SUBSCRIBER_FAILED", x.getEvent().getClass().getSimpleName(),
                       String.valueOf(x.getException()));
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

    /**
     * Payment to the escrow of this registry, price to the fee receiver and the change back to the caller. Must run
     * inside a treasury transaction so that a failed step returns every moved value.
     */
    private void collectPayment(Address caller, Decimal payment, Decimal price) throws NameServiceError {
        if (!treasury.transfer(caller, address, payment))
            throw new NameServiceError(Errors.TRANSFER_FAILED, "payment", "can't collect " + payment + " from " + caller);
        if (!treasury.transfer(address, feeReceiver, price))
            throw new NameServiceError(Errors.TRANSFER_FAILED, "fee", "can't forward " + price + " to " + feeReceiver);
        Decimal change = payment.subtract(price);
        if (change.isPositive() && !treasury.transfer(address, caller, change))
            throw new NameServiceError(Errors.TRANSFER_FAILED, "refund", "can't refund " + change + " to " + caller);
    }

    private TokenId mintAndLink(NameHash hash, Address owner) {
        TokenId tokenId = tokens.mint(owner);
        try {
            addressBook.linkNameToOwner(hash, owner);
        } catch (RuntimeException e) {
            tokens.burn(tokenId);
            reporter.error("LINK_FAILED", String.valueOf(hash), e.toString());
            throw e;
        }
        return tokenId;
    }

    private void store(NameHash hash, TokenId tokenId, DomainRecord record) {
        records.put(hash, record);
        tokenByHash.put(hash, tokenId);
        hashByToken.put(tokenId, hash);
    }

    private DomainRecord requireHolder(NameHash hash, String object, Address caller) throws NameServiceError {
        DomainRecord record = records.get(hash);
        if (record == null || !tokenByHash.containsKey(hash))
            throw new NameServiceError(Errors.NOT_FOUND, object, "name is not registered");
        if (!isHolder(hash, caller))
            throw new NameServiceError(Errors.NOT_OWNER, object, caller + " does not hold the name");
        return record;
    }

    private void requireAdmin(Address caller) throws NameServiceError {
        if (caller == null || !caller.equals(admin))
            throw new NameServiceError(Errors.UNAUTHORIZED, "caller", caller + " is not the namespace admin");
    }

    private static void requireHash(NameHash hash) throws NameServiceError {
        if (hash == null)
            throw new NameServiceError(Errors.BAD_VALUE, "hash", "name hash is required");
    }

    private static void requireCaller(Address caller) throws NameServiceError {
        if (caller == null)
            throw new NameServiceError(Errors.BAD_VALUE, "caller", "caller address is required");
    }

    private static void checkPayment(String name, Decimal payment, Decimal price) throws NameServiceError {
        if (payment == null || payment.isNegative())
            throw new NameServiceError(Errors.BAD_VALUE, "payment", "payment can't be negative");
        if (payment.compareTo(price) < 0)
            throw new NameServiceError(Errors.INSUFFICIENT_PAYMENT, name,
                                       "price is " + price + ", paid only " + payment);
    }

    private String fullName(String canonical) {
        return canonical + "." + label;
    }

    private ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }

    @Override
    public String toString() {
        return "Registry(" + label + "@" + address + ")";
    }

    /**
     * Wiring of a new registry. Everything but the clock, the informer and the verbose level is required.
     */
    public static class Builder {

        private String label;
        private Address address;
        private Address admin;
        private TokenLedger tokens;
        private ResolverAddressBook addressBook;
        private Treasury treasury;
        private RecordLedger recordLedger;
        private Address feeReceiver;
        private List<PriceTier> priceTiers = new ArrayList<>();
        private Duration expirationPeriod;
        private Clock clock = Clock.systemUTC();
        private Informer informer;
        private BufferedLogger logger;
        private int verboseLevel = VerboseLevel.BASE;

        private Builder() {
        }

        /**
         * Namespace label, canonicalized on {@link #build()}.
         */
        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder address(Address address) {
            this.address = address;
            return this;
        }

        public Builder admin(Address admin) {
            this.admin = admin;
            return this;
        }

        public Builder tokenLedger(TokenLedger tokens) {
            this.tokens = tokens;
            return this;
        }

        public Builder addressBook(ResolverAddressBook addressBook) {
            this.addressBook = addressBook;
            return this;
        }

        public Builder treasury(Treasury treasury) {
            this.treasury = treasury;
            return this;
        }

        public Builder recordLedger(RecordLedger recordLedger) {
            this.recordLedger = recordLedger;
            return this;
        }

        public Builder feeReceiver(Address feeReceiver) {
            this.feeReceiver = feeReceiver;
            return this;
        }

        /**
         * Initial price tiers. The registry keeps its own copy, so later changes affect only it.
         */
        public Builder priceTiers(List<PriceTier> tiers) {
            this.priceTiers = new ArrayList<>(tiers);
            return this;
        }

        public Builder expirationPeriod(Duration period) {
            this.expirationPeriod = period;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Informer to post events to. If it has no exception listener yet, the registry installs one that logs
         * subscriber failures. A new informer is used if none is given.
         */
        public Builder informer(Informer informer) {
            this.informer = informer;
            return this;
        }

        public Builder logger(BufferedLogger logger, int verboseLevel) {
            this.logger = logger;
            this.verboseLevel = verboseLevel;
            return this;
        }

        public Registry build() throws NameServiceError {
            label = NameCanonicalizer.canonical(label);
            if (address == null || admin == null || tokens == null || addressBook == null || treasury == null
                    || recordLedger == null || feeReceiver == null || logger == null || clock == null)
                throw new IllegalArgumentException("registry " + label + " is not fully wired");
            if (expirationPeriod == null || expirationPeriod.isNegative() || expirationPeriod.isZero())
                throw new IllegalArgumentException("expiration period must be positive");
            return new Registry(this);
        }
    }
}
