package org.polylog.driver;

import org.json.JSONArray;

import java.util.ArrayList;
import java.util.List;

/**
 * A logger whose history did not match what was recorded into it.
 */
public class HistoryMismatch {
    private final String loggerName;
    private final List<String> expected;
    private final List<String> observed;

    public HistoryMismatch(String loggerName, List<String> expected, List<String> observed) {
        this.loggerName = loggerName;
        this.expected = new ArrayList<>(expected);
        this.observed = new ArrayList<>(observed);
    }

    public String getLoggerName() {
        return loggerName;
    }

    public List<String> getExpected() {
        return expected;
    }

    public List<String> getObserved() {
        return observed;
    }

    // sequences are rendered as JSON arrays so commas inside messages stay readable
    public String describe() {
        return loggerName + ": expected: " + new JSONArray(expected) + "; but observed: " + new JSONArray(observed);
    }

    @Override
    public String toString() {
        return describe();
    }
}
