package org.polylog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.polylog.driver.DriverConfig;
import org.polylog.logger.FileLogger;
import org.polylog.logger.LoggerException;
import org.polylog.logger.WriteMode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DriverMainTest {

    @TempDir
    Path dir;

    @Test
    public void testEndToEnd() throws IOException {
        Path out = dir.resolve("outfile.txt");
        assertEquals(DriverMain.EXIT_OK, DriverMain.run(new String[]{out.toString()}));
        assertEquals(Arrays.asList("Hello, World!", "abracadabra", "Sayonara!"),
                Files.readAllLines(out, StandardCharsets.UTF_8));
    }

    @Test
    public void testRerunStartsFromFreshFile() throws IOException {
        Path out = dir.resolve("outfile.txt");
        assertEquals(DriverMain.EXIT_OK, DriverMain.run(new String[]{out.toString()}));
        assertEquals(DriverMain.EXIT_OK, DriverMain.run(new String[]{out.toString()}));
        assertEquals(3, Files.readAllLines(out, StandardCharsets.UTF_8).size());
    }

    @Test
    public void testWithJsonLogger() throws IOException {
        Path out = dir.resolve("outfile.txt");
        Path json = dir.resolve("outfile.jsonl");
        DriverConfig config = new DriverConfig(out, WriteMode.TRUNCATE, json, false);
        assertEquals(DriverMain.EXIT_OK, DriverMain.run(config));
        assertEquals(3, Files.readAllLines(json, StandardCharsets.UTF_8).size());
    }

    @Test
    public void testEmptyRun() throws IOException {
        Path out = dir.resolve("outfile.txt");
        DriverConfig config = new DriverConfig(out, WriteMode.TRUNCATE, null, true);
        assertEquals(DriverMain.EXIT_OK, DriverMain.run(config));
        assertEquals(0, Files.size(out));
    }

    @Test
    public void testAppendOntoExistingContentIsAMismatch() throws IOException {
        Path out = dir.resolve("outfile.txt");
        Files.write(out, List.of("left over"), StandardCharsets.UTF_8);
        DriverConfig config = new DriverConfig(out, WriteMode.APPEND, null, false);
        assertEquals(DriverMain.EXIT_MISMATCH, DriverMain.run(config));
    }

    @Test
    public void testUnopenableOutputFile() {
        Path out = dir.resolve("missing").resolve("outfile.txt");
        assertEquals(DriverMain.EXIT_UNOPENABLE, DriverMain.run(new String[]{out.toString()}));
        assertFalse(Files.exists(out));
    }

    @Test
    public void testTooManyArguments() {
        assertEquals(DriverMain.EXIT_USAGE, DriverMain.run(new String[]{"a", "b"}));
    }

    @Test
    public void testFailingCloseDoesNotStopTheOthers() throws IOException {
        FileLogger failing = new FileLogger(dir.resolve("failing.txt")) {
            @Override
            public void close() {
                super.close();
                throw new LoggerException("Failed to close " + getPath(), new IOException("device gone"));
            }
        };
        FileLogger healthy = new FileLogger(dir.resolve("healthy.txt"));

        DriverMain.closeAll(Arrays.asList(failing, healthy));

        assertTrue(failing.isClosed());
        assertTrue(healthy.isClosed());
    }
}
