package com.icodici.names.tools;

import java.util.concurrent.Callable;

/**
 * Labelled report channel of a component. Messages go to the shared {@link BufferedLogger} when their level does not
 * exceed the current verbose level, see {@link VerboseLevel}. Message sources are evaluated lazily so that detailed
 * reports cost nothing while the level is lower.
 */
public class Reporter {

    private final String label;
    private final BufferedLogger logger;
    private volatile int verboseLevel;

    public Reporter(String label, BufferedLogger logger, int verboseLevel) {
        this.label = label;
        this.logger = logger;
        this.verboseLevel = verboseLevel;
    }

    public String getLabel() {
        return label;
    }

    public int getVerboseLevel() {
        return verboseLevel;
    }

    public void setVerboseLevel(int level) {
        this.verboseLevel = level;
    }

    public void report(String message, int level) {
        if (level <= verboseLevel)
            logger.log(label + message);
    }

    public void report(Callable<String> message, int level) {
        if (level <= verboseLevel) {
            try {
                logger.log(label + message.call());
            } catch (Exception e) {
                logger.log(label + "failed to build report message: " + e);
            }
        }
    }

    public void report(Callable<String> message) {
        report(message, VerboseLevel.DETAILED);
    }

    /**
     * Errors are always logged, whatever the verbose level is.
     */
    public void error(String code, String object, String text) {
        StringBuilder sb = new StringBuilder(label).append("** ERROR: ").append(code);
        if (object != null && !object.isEmpty())
            sb.append(": ").append(object);
        if (text != null && !text.isEmpty())
            sb.append(": ").append(text);
        logger.log(sb.toString());
    }

    public static String concat(Object... messages) {
        StringBuilder sb = new StringBuilder();
        for (Object m : messages)
            sb.append(m != null ? m.toString() : "null");
        return sb.toString();
    }
}
