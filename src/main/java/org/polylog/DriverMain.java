package org.polylog;

import org.polylog.driver.DriverConfig;
import org.polylog.driver.HistoryMismatch;
import org.polylog.driver.LoggerDriver;
import org.polylog.logger.FileLogger;
import org.polylog.logger.InMemoryLogger;
import org.polylog.logger.JsonFileLogger;
import org.polylog.logger.LoggerException;
import org.polylog.logger.MessageLogger;
import org.polylog.logger.PersistentLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class DriverMain {

    private static final Logger log = LoggerFactory.getLogger(DriverMain.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_MISMATCH = 1;
    public static final int EXIT_UNOPENABLE = 2;
    public static final int EXIT_USAGE = 64;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        DriverConfig config;
        try {
            config = DriverConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            log.error("Usage: DriverMain [outputPath] ({})", e.getMessage());
            return EXIT_USAGE;
        }
        return run(config);
    }

    public static int run(DriverConfig config) {
        List<MessageLogger> loggers = new ArrayList<>();
        List<PersistentLogger> opened = new ArrayList<>();
        try {
            loggers.add(new InMemoryLogger());
            FileLogger fileLogger = new FileLogger(config.getOutputPath(), config.getWriteMode());
            opened.add(fileLogger);
            loggers.add(fileLogger);
            if (config.getJsonPath() != null) {
                JsonFileLogger jsonLogger = new JsonFileLogger(config.getJsonPath(), config.getWriteMode());
                opened.add(jsonLogger);
                loggers.add(jsonLogger);
            }
        } catch (IOException | LoggerException e) {
            log.error("Failed to open file: {}", e.getMessage());
            closeAll(opened);
            return EXIT_UNOPENABLE;
        }

        try {
            List<String> messages = config.isEmptyRun() ? Collections.<String>emptyList() : LoggerDriver.TEST_MESSAGES;
            List<HistoryMismatch> mismatches = new LoggerDriver(loggers).run(messages);
            if (!mismatches.isEmpty()) {
                for (HistoryMismatch mismatch : mismatches) {
                    log.error(mismatch.describe());
                }
                return EXIT_MISMATCH;
            }
            log.info("{} loggers reproduced {} messages, output in {}", loggers.size(), messages.size(), config.getOutputPath());
            return EXIT_OK;
        } catch (LoggerException e) {
            log.error("Backing file became unusable", e);
            return EXIT_UNOPENABLE;
        } finally {
            closeAll(opened);
        }
    }

    // a failing close is logged but never changes the exit status
    static void closeAll(List<? extends PersistentLogger> loggers) {
        for (PersistentLogger logger : loggers) {
            try {
                logger.close();
            } catch (LoggerException e) {
                log.error("Failed to close {} logger on {}", logger.name(), logger.getPath(), e);
            }
        }
    }
}
