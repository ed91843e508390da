package org.polylog.logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Keeps the messages in a process-local list. Nothing is delimited, so any
 * message text is accepted.
 */
public class InMemoryLogger implements MessageLogger {

    private final ArrayList<String> messages = new ArrayList<>();

    @Override
    public void record(String message) {
        messages.add(Objects.requireNonNull(message, "message"));
    }

    @Override
    public List<String> history() {
        return new ArrayList<>(messages);
    }

    @Override
    public String name() {
        return "in-memory";
    }
}
