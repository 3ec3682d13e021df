package com.icodici.names.tools;

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class BufferedLoggerTest {

    @Test
    public void lastEntries() throws Exception {
        try (BufferedLogger log = new BufferedLogger(100)) {
            for (int i = 0; i < 10; i++) {
                log.log("line " + i);
            }
            assertTrue(log.flush(1000));
            List<BufferedLogger.Entry> entries = log.getLast(3);
            assertEquals("line 7,line 8,line 9", str(entries));
            assertEquals("line 0,line 1,line 2,line 3,line 4,line 5,line 6,line 7,line 8,line 9",
                         str(log.getLast(300)));
        }
    }

    protected String str(List<BufferedLogger.Entry> list) {
        return list.stream()
                .map(x -> x.message)
                .collect(Collectors.joining(","));
    }

    @Test
    public void log() throws Exception {
        try (BufferedLogger log = new BufferedLogger(3)) {
            for (int i = 0; i < 10; i++) {
                log.log("line " + i);
            }
            log.flush(1000);
            assertEquals("line 7,line 8,line 9", str(log.getCopy()));
            log.clear();
            assertEquals(0, log.getCopy().size());
        }
    }

    @Test
    public void printTo() throws Exception {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (BufferedLogger log = new BufferedLogger(10)) {
            log.printTo(new PrintStream(bos, true), false);
            log.log("Hello, world");
            log.log("last line");
            log.flush(1000);
        }
        assertEquals("Hello, world\nlast line\n", bos.toString().replace("\r\n", "\n"));
    }

    @Test
    public void entriesAreOrdered() throws Exception {
        try (BufferedLogger log = new BufferedLogger(10)) {
            BufferedLogger.Entry e1 = log.log("first");
            BufferedLogger.Entry e2 = log.log("second");
            assertTrue(e1.compareTo(e2) < 0);
            assertTrue(e2.toString().endsWith(" second"));
        }
    }
}
