package org.atmoswing.forecast.core.exception;

/**
 * Base class of the errors raised while reading and aggregating forecast files.
 */
public class ForecastException extends RuntimeException {

    public ForecastException(String message) {
        super(message);
    }

    public ForecastException(String message, Throwable cause) {
        super(message, cause);
    }
}
