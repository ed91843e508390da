package org.polylog.driver;

import org.polylog.logger.MessageLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Feeds the same messages to a fixed set of loggers and checks that every one
 * of them reports them back unchanged.
 */
public class LoggerDriver {

    private static final Logger log = LoggerFactory.getLogger(LoggerDriver.class);

    public static final List<String> TEST_MESSAGES = Collections.unmodifiableList(Arrays.asList(
            "Hello, World!",
            "abracadabra",
            "Sayonara!"
    ));

    private final List<MessageLogger> loggers;

    public LoggerDriver(List<? extends MessageLogger> loggers) {
        this.loggers = Collections.unmodifiableList(new ArrayList<>(loggers));
    }

    /**
     * Records each message into every logger, message by message, loggers in
     * collection order.
     */
    public void recordAll(List<String> messages) {
        for (String message : messages) {
            for (MessageLogger logger : loggers) {
                logger.record(message);
            }
        }
        log.debug("Recorded {} messages into {} loggers", messages.size(), loggers.size());
    }

    /**
     * @return one mismatch per logger whose history differs from {@code expected};
     * empty when all of them agree
     */
    public List<HistoryMismatch> verify(List<String> expected) {
        List<HistoryMismatch> mismatches = new ArrayList<>();
        for (MessageLogger logger : loggers) {
            List<String> observed = logger.history();
            if (!observed.equals(expected)) {
                mismatches.add(new HistoryMismatch(logger.name(), expected, observed));
            }
        }
        return mismatches;
    }

    public List<HistoryMismatch> run(List<String> messages) {
        recordAll(messages);
        return verify(messages);
    }
}
