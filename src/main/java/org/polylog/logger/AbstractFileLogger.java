package org.polylog.logger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Line-oriented file plumbing shared by the file-backed loggers.
 * <p>
 * Every line is flushed and forced to storage before {@link #appendLine} returns,
 * and reads always go through a freshly opened reader, so a read issued right
 * after a write sees it.
 */
public abstract class AbstractFileLogger implements PersistentLogger {

    private static final Logger log = LoggerFactory.getLogger(AbstractFileLogger.class);

    private final Path path;
    private final FileChannel channel;
    private final BufferedWriter writer;
    private boolean closed;

    protected AbstractFileLogger(Path path, WriteMode mode) throws IOException {
        this.path = Objects.requireNonNull(path, "path");
        boolean existed = Files.exists(path);
        this.channel = FileChannel.open(path, mode.openOptions());
        this.writer = new BufferedWriter(new OutputStreamWriter(Channels.newOutputStream(channel), StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)));
        if (existed) {
            log.debug("{} already exists, opened with {}", path, mode);
        } else {
            log.debug("{} created", path);
        }
    }

    /**
     * @throws IllegalArgumentException if the message cannot be stored as UTF-8,
     *                                  e.g. it holds an unpaired surrogate
     */
    protected static String requireEncodable(String message) {
        Objects.requireNonNull(message, "message");
        if (!StandardCharsets.UTF_8.newEncoder().canEncode(message)) {
            throw new IllegalArgumentException("Message is not valid UTF-16 text: " + message);
        }
        return message;
    }

    protected void appendLine(String line) {
        if (closed) {
            throw new IllegalStateException(name() + " logger on " + path + " is closed");
        }
        try {
            writer.write(line);
            writer.write('\n');
            writer.flush();
            channel.force(false);
        } catch (IOException e) {
            throw new LoggerException("Failed to write to " + path, e);
        }
    }

    protected List<String> readLines() {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new LoggerException("Failed to read " + path, e);
        }
        return lines;
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.close();
            log.debug("{} closed", path);
        } catch (IOException e) {
            throw new LoggerException("Failed to close " + path, e);
        }
    }
}
