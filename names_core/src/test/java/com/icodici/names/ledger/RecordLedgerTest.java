package com.icodici.names.ledger;

import com.icodici.names.Address;
import com.icodici.names.Decimal;
import com.icodici.names.Errors;
import com.icodici.names.events.RecordAdded;
import com.icodici.names.tools.Informer;
import com.icodici.names.tools.Subscriber;
import org.junit.Before;
import org.junit.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.icodici.names.ErrorAssert.assertError;
import static org.junit.Assert.*;

public class RecordLedgerTest {

    static public class Recorder {

        public final List<Integer> indexes = Collections.synchronizedList(new ArrayList<>());

        @Subscriber
        public void onRecord(RecordAdded e) {
            indexes.add(e.getIndex());
        }
    }

    private final Address alice = Address.of("alice");
    private final Address bob = Address.of("bob");
    private final Address eth = Address.of("factory/eth");
    private final Address xyz = Address.of("factory/xyz");
    private final ZonedDateTime t0 = ZonedDateTime.of(2026, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    private RecordLedger ledger;
    private Recorder recorder;

    @Before
    public void setUp() {
        Informer informer = new Informer();
        recorder = new Recorder();
        informer.registerStrong(recorder);
        ledger = new RecordLedger(informer);
    }

    private LedgerEntry add(String name, Address owner, Address source) {
        return ledger.append(name, owner, t0, t0.plusDays(365), new Decimal(5), source);
    }

    private static List<String> names(List<LedgerEntry> entries) {
        return entries.stream().map(LedgerEntry::getFullName).collect(Collectors.toList());
    }

    @Test
    public void appendAndIndex() throws Exception {
        add("abcd.eth", alice, eth);
        add("abcd.xyz", alice, xyz);
        add("bobs.eth", bob, eth);
        add("more.eth", alice, eth);

        assertEquals(4, ledger.size());
        assertEquals(List.of("abcd.eth", "abcd.xyz", "bobs.eth", "more.eth"), names(ledger.allEntries()));
        assertEquals(List.of("abcd.eth", "abcd.xyz", "more.eth"), names(ledger.entriesByOwner(alice)));
        assertEquals(List.of("bobs.eth"), names(ledger.entriesByOwner(bob)));
        assertEquals(List.of("abcd.eth", "bobs.eth", "more.eth"), names(ledger.entriesBySource(eth)));
        assertEquals(List.of("abcd.xyz"), names(ledger.entriesBySource(xyz)));
        assertTrue(ledger.entriesByOwner(Address.of("nobody")).isEmpty());
        assertEquals(List.of(0, 1, 2, 3), recorder.indexes);
    }

    @Test
    public void entryAt() throws Exception {
        LedgerEntry e = add("abcd.eth", alice, eth);
        assertEquals(e, ledger.entryAt(0));
        assertEquals(0, e.getIndex());
        assertEquals(t0, e.getRegisteredAt());
        assertEquals(t0.plusDays(365), e.getExpiresAt());
        assertEquals(new Decimal(5), e.getPrice());
        assertError(Errors.NOT_FOUND, () -> ledger.entryAt(1));
        assertError(Errors.NOT_FOUND, () -> ledger.entryAt(-1));
    }

    @Test
    public void projectionsAreSnapshots() throws Exception {
        add("abcd.eth", alice, eth);
        List<LedgerEntry> all = ledger.allEntries();
        add("efgh.eth", alice, eth);
        assertEquals(1, all.size());
        try {
            all.add(all.get(0));
            fail("must be read only");
        } catch (UnsupportedOperationException e) {
            assertEquals(2, ledger.size());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullsRejected() throws Exception {
        ledger.append("abcd.eth", null, t0, t0, Decimal.ONE, eth);
    }

    @Test
    public void concurrentAppends() throws Exception {
        ExecutorService es = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 100; i++) {
            Address owner = i % 2 == 0 ? alice : bob;
            String name = "n" + i + ".eth";
            es.execute(() -> add(name, owner, eth));
        }
        es.shutdown();
        assertTrue(es.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(100, ledger.size());
        assertEquals(50, ledger.entriesByOwner(alice).size());
        assertEquals(100, ledger.entriesBySource(eth).size());
        List<LedgerEntry> all = ledger.allEntries();
        for (int i = 0; i < all.size(); i++)
            assertEquals(i, all.get(i).getIndex());
    }
}
