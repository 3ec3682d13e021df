package com.icodici.names.tools;

/**
 * The event that is automatically posted if no one has received some other posted event
 */
public class LostEvent {
    private final Object source;

    public LostEvent(Object sourceEvent) {
        source = sourceEvent;
    }

    public Object getSource() {
        return source;
    }
}
