package org.polylog.logger;

import java.nio.file.OpenOption;
import java.nio.file.StandardOpenOption;

/**
 * How a file-backed logger treats content already present at its path.
 */
public enum WriteMode {

    // start from an empty file
    TRUNCATE(StandardOpenOption.TRUNCATE_EXISTING),
    // keep existing lines, new records go after them
    APPEND(StandardOpenOption.APPEND);

    private final StandardOpenOption option;

    WriteMode(StandardOpenOption option) {
        this.option = option;
    }

    OpenOption[] openOptions() {
        return new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.WRITE, option};
    }

    public static WriteMode parse(String value) {
        for (WriteMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown write mode: " + value);
    }
}
