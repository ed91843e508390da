package org.polylog.logger;

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes every message as a JSON object on its own line, e.g.
 * {@code {"index":0,"message":"Hello, World!"}}.
 * <p>
 * Line terminators inside a message are escaped by the JSON encoding, so unlike
 * {@link FileLogger} this logger accepts multi-line messages.
 */
public class JsonFileLogger extends AbstractFileLogger {

    private static final Logger log = LoggerFactory.getLogger(JsonFileLogger.class);

    private int nextIndex;

    public JsonFileLogger(Path path) throws IOException {
        this(path, WriteMode.TRUNCATE);
    }

    public JsonFileLogger(Path path, WriteMode mode) throws IOException {
        super(path, mode);
        if (mode == WriteMode.APPEND) {
            List<LogEntry> existing;
            try {
                existing = entries();
            } catch (LoggerException e) {
                close();
                throw e;
            }
            nextIndex = existing.isEmpty() ? 0 : existing.get(existing.size() - 1).getIndex() + 1;
            log.debug("Recovered {} entries from {}, next index {}", existing.size(), path, nextIndex);
        }
    }

    @Override
    public void record(String message) {
        LogEntry entry = new LogEntry(nextIndex, requireEncodable(message));
        appendLine(entry.toJson().toString());
        nextIndex++;
    }

    @Override
    public List<String> history() {
        List<String> messages = new ArrayList<>();
        for (LogEntry entry : entries()) {
            messages.add(entry.getMessage());
        }
        return messages;
    }

    /**
     * Parses the whole file into entries, in file order.
     *
     * @throws LoggerException if a line is not a valid entry
     */
    public List<LogEntry> entries() {
        List<String> lines = readLines();
        List<LogEntry> entries = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            try {
                entries.add(LogEntry.fromJson(new JSONObject(lines.get(i))));
            } catch (JSONException e) {
                throw new LoggerException("Malformed entry at " + getPath() + ":" + (i + 1), e);
            }
        }
        return entries;
    }

    @Override
    public String name() {
        return "json-file";
    }
}
