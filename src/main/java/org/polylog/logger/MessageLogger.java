package org.polylog.logger;

import java.util.List;

/**
 * A logger that keeps every message it is given, in order.
 */
public interface MessageLogger {

    /**
     * Appends a message to the backing store.
     */
    void record(String message);

    /**
     * Returns all recorded messages in recording order. The returned list is a
     * fresh copy owned by the caller.
     */
    List<String> history();

    String name();
}
