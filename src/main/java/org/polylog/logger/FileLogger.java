package org.polylog.logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes one message per line to a plain UTF-8 text file and rebuilds the
 * history by reading the file back from the start.
 */
public class FileLogger extends AbstractFileLogger {

    public FileLogger(Path path) throws IOException {
        this(path, WriteMode.TRUNCATE);
    }

    public FileLogger(Path path, WriteMode mode) throws IOException {
        super(path, mode);
    }

    /**
     * @throws IllegalArgumentException if the message contains a line terminator,
     *                                  since lines are the record delimiter, or
     *                                  cannot be encoded as UTF-8
     */
    @Override
    public void record(String message) {
        appendLine(requireEncodable(requireSingleLine(message)));
    }

    @Override
    public List<String> history() {
        return readLines();
    }

    @Override
    public String name() {
        return "file";
    }

    static String requireSingleLine(String message) {
        Objects.requireNonNull(message, "message");
        if (message.indexOf('\n') >= 0 || message.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Message must not contain a line terminator: " + message.replace("\r", "\\r").replace("\n", "\\n"));
        }
        return message;
    }
}
