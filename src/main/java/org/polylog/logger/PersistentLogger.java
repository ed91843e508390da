package org.polylog.logger;

import java.io.Closeable;
import java.nio.file.Path;

/**
 * A logger backed by a single file. The file is the only source of truth for
 * {@link #history()} and outlives the logger: closing releases the write
 * handle but never deletes the file.
 */
public interface PersistentLogger extends MessageLogger, Closeable {

    Path getPath();

    boolean isClosed();

    @Override
    void close();
}
