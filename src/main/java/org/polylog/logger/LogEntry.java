package org.polylog.logger;

import org.json.JSONObject;

/**
 * One recorded message together with its position in the log.
 */
public class LogEntry {
    private final int index;
    private final String message;

    public LogEntry(int index, String message) {
        this.index = index;
        this.message = message;
    }

    public int getIndex() {
        return index;
    }

    public String getMessage() {
        return message;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("index", index);
        json.put("message", message);
        return json;
    }

    public static LogEntry fromJson(JSONObject json) {
        return new LogEntry(json.getInt("index"), json.getString("message"));
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
