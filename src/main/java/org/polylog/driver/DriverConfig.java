package org.polylog.driver;

import org.polylog.logger.WriteMode;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Settings for a driver run, taken from the command line and system properties.
 */
public class DriverConfig {

    public static final String DEFAULT_FILE_NAME = "outfile_java.txt";
    public static final String MODE_PROPERTY = "polylog.mode";
    public static final String JSON_PROPERTY = "polylog.json";
    public static final String EMPTY_PROPERTY = "polylog.empty";

    private final Path outputPath;
    private final WriteMode writeMode;
    private final Path jsonPath;
    private final boolean emptyRun;

    public DriverConfig(Path outputPath, WriteMode writeMode, Path jsonPath, boolean emptyRun) {
        this.outputPath = outputPath;
        this.writeMode = writeMode;
        this.jsonPath = jsonPath;
        this.emptyRun = emptyRun;
    }

    public static DriverConfig fromArgs(String[] args) {
        return fromArgs(args, System.getProperties());
    }

    /**
     * @throws IllegalArgumentException on more than one argument or an unknown write mode
     */
    public static DriverConfig fromArgs(String[] args, Properties properties) {
        if (args.length > 1) {
            throw new IllegalArgumentException("Expected at most one argument (output path), got " + args.length);
        }
        Path output = args.length == 1
                ? Paths.get(args[0])
                : Paths.get(properties.getProperty("java.io.tmpdir", "/tmp"), DEFAULT_FILE_NAME);

        WriteMode mode = WriteMode.parse(properties.getProperty(MODE_PROPERTY, WriteMode.TRUNCATE.name()));

        String json = properties.getProperty(JSON_PROPERTY);
        Path jsonPath = (json == null || json.isBlank()) ? null : Paths.get(json);

        boolean empty = Boolean.parseBoolean(properties.getProperty(EMPTY_PROPERTY, "false"));
        return new DriverConfig(output, mode, jsonPath, empty);
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public WriteMode getWriteMode() {
        return writeMode;
    }

    // null unless a JSON-lines logger should join the run
    public Path getJsonPath() {
        return jsonPath;
    }

    public boolean isEmptyRun() {
        return emptyRun;
    }
}
