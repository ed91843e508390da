package org.polylog.logger;

/**
 * Thrown when a logger cannot reach its backing store after it was opened.
 */
public class LoggerException extends RuntimeException {

    public LoggerException(String message, Throwable cause) {
        super(message, cause);
    }
}
