package com.icodici.names.tools;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;

public class ReporterTest {

    private BufferedLogger logger;

    @Before
    public void setUp() {
        logger = new BufferedLogger(100);
    }

    @After
    public void tearDown() {
        logger.close();
    }

    private String logged() {
        logger.flush(1000);
        return logger.getCopy().stream().map(e -> e.message).collect(Collectors.joining("|"));
    }

    @Test
    public void levels() throws Exception {
        Reporter r = new Reporter("ns(eth): ", logger, VerboseLevel.BASE);
        r.report("base", VerboseLevel.BASE);
        r.report("detailed", VerboseLevel.DETAILED);
        r.report(() -> "lazy", VerboseLevel.BASE);
        assertEquals("ns(eth): base|ns(eth): lazy", logged());

        r.setVerboseLevel(VerboseLevel.DETAILED);
        r.report(() -> "detailed");
        assertEquals("ns(eth): base|ns(eth): lazy|ns(eth): detailed", logged());
    }

    @Test
    public void nothingSkipsMessageBuilding() throws Exception {
        Reporter r = new Reporter("x: ", logger, VerboseLevel.NOTHING);
        r.report(() -> {
            throw new IllegalStateException("must not be called");
        }, VerboseLevel.BASE);
        assertEquals("", logged());
    }

    @Test
    public void brokenMessageIsReported() throws Exception {
        Reporter r = new Reporter("x: ", logger, VerboseLevel.BASE);
        r.report(() -> {
            throw new IllegalStateException("oops");
        }, VerboseLevel.BASE);
        assertEquals("x: failed to build report message: java.lang.IllegalStateException: oops", logged());
    }

    @Test
    public void errorsAreAlwaysLogged() throws Exception {
        Reporter r = new Reporter("x: ", logger, VerboseLevel.NOTHING);
        r.error("LINK_FAILED", "alice", "refused");
        assertEquals("x: ** ERROR: LINK_FAILED: alice: refused", logged());
    }

    @Test
    public void verboseLevelNames() throws Exception {
        assertEquals(VerboseLevel.DETAILED, VerboseLevel.stringToInt(" Detailed "));
        assertEquals("base", VerboseLevel.intToString(VerboseLevel.BASE));
        assertEquals("x=1, y=null", Reporter.concat("x=", 1, ", y=", null));
    }
}
