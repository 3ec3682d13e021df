package com.icodici.names.tools;

import org.checkerframework.checker.nullness.qual.NonNull;

import java.io.PrintStream;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fast asynchronous buffered logger, thread safe. It's main features are:
 * <p>
 * - it does not block caller on {@link #log(String)} using daemon thread to queue all logging requests
 * <p>
 * - it holds last records in memory from where they could be obtained using {@link #getLast(int)} and {@link
 * #getCopy()} calls.
 * <p>
 * It is possible to mirror the log to a {@link PrintStream} using {@link #printTo(PrintStream, boolean)}.
 */
public class BufferedLogger implements AutoCloseable {

    /**
     * Log entry structure provides ID to navigate, creation instant and the message.
     */
    public static class Entry implements Comparable<Entry> {

        static private final AtomicLong serial = new AtomicLong(System.currentTimeMillis());

        public final long id;
        public final Instant instant = Instant.now();
        public final String message;

        private Entry(String message) {
            id = serial.getAndIncrement();
            this.message = message;
        }

        @Override
        public String toString() {
            return fmt.format(instant) + " " + message;
        }

        /**
         * Natural order is the {@link #id}, not the instant.
         */
        @Override
        public int compareTo(Entry e) {
            return Long.compare(id, e.id);
        }
    }

    private static final DateTimeFormatter fmt = DateTimeFormatter.ISO_INSTANT;
    private static final Entry STOP = new Entry("");

    private final int maxEntries;
    private final LinkedList<Entry> buffer = new LinkedList<>();
    private final BlockingQueue<Entry> queue = new LinkedBlockingQueue<>();
    private final Object queueEmpty = new Object();
    private final AtomicLong pending = new AtomicLong();
    private volatile PrintStream printStream;
    private volatile boolean printTimestamp = false;
    private Thread loggerThread;

    /**
     * Create buffered logger capable to hold in memory up to specified number of entries, the excessive records are
     * purged automatically, oldest first.
     *
     * @param maxEntries buffer capacity, should be positive
     */
    public BufferedLogger(int maxEntries) {
        if (maxEntries < 1)
            throw new IllegalArgumentException("maxEntries should be positive");
        this.maxEntries = maxEntries;
        loggerThread = new Thread(this::drain);
        loggerThread.setName("BufferedLogger_" + Integer.toHexString(hashCode()));
        loggerThread.setDaemon(true);
        loggerThread.start();
    }

    private void drain() {
        while (true) {
            Entry entry;
            try {
                entry = queue.take();
            } catch (InterruptedException e) {
                return;
            }
            if (entry == STOP)
                return;
            synchronized (buffer) {
                buffer.add(entry);
                while (buffer.size() > maxEntries)
                    buffer.poll();
            }
            PrintStream ps = printStream;
            if (ps != null)
                ps.println(printTimestamp ? entry.toString() : entry.message);
            if (pending.decrementAndGet() == 0) {
                synchronized (queueEmpty) {
                    queueEmpty.notifyAll();
                }
            }
        }
    }

    /**
     * Add log entry to the queue. The entry becomes visible in {@link #getLast(int)} once the logger thread has
     * processed it, see {@link #flush(long)}.
     *
     * @return entry created for the log message
     */
    public @NonNull Entry log(String message) {
        Entry entry = new Entry(message);
        pending.incrementAndGet();
        queue.add(entry);
        return entry;
    }

    /**
     * Wait for log messages queue emptied up to specified number of milliseconds
     *
     * @param millis to stop waiting after
     *
     * @return true if the messages queue is emptied, false if timeout is expired
     */
    public boolean flush(long millis) {
        long deadline = System.currentTimeMillis() + millis;
        synchronized (queueEmpty) {
            while (pending.get() > 0) {
                long left = deadline - System.currentTimeMillis();
                if (left <= 0)
                    return false;
                try {
                    queueEmpty.wait(Math.min(left, 50));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Copy results to a given PrintStream (to be used with System.out, for example)
     *
     * @param ps             printStream to print to. Use null to cancel.
     * @param printTimestamp true to add ISO timestamp to each line (like 2017-09-15T14:52:25.287Z)
     *
     * @return null or previously associated PrintStream
     */
    public PrintStream printTo(PrintStream ps, boolean printTimestamp) {
        this.printTimestamp = printTimestamp;
        PrintStream old = printStream;
        printStream = ps;
        return old;
    }

    /**
     * Return most recent records up to specified number of entries.
     *
     * @param maxEntries must be > 0. If current number of records is less than specified, returns all.
     *
     * @return entries in the logging order
     */
    public @NonNull List<Entry> getLast(int maxEntries) {
        ArrayList<Entry> results = new ArrayList<>(maxEntries);
        synchronized (buffer) {
            for (Iterator<Entry> it = buffer.descendingIterator(); it.hasNext() && maxEntries > 0; maxEntries--)
                results.add(it.next());
        }
        Collections.reverse(results);
        return results;
    }

    /**
     * Get a copy af all currently stored entries
     *
     * @return list of entries sorted by id
     */
    public @NonNull List<Entry> getCopy() {
        synchronized (buffer) {
            return new ArrayList<>(buffer);
        }
    }

    public void clear() {
        synchronized (buffer) {
            buffer.clear();
        }
    }

    @Override
    public void close() {
        if (loggerThread != null) {
            queue.add(STOP);
            loggerThread = null;
        }
    }
}
