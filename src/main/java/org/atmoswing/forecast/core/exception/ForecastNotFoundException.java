package org.atmoswing.forecast.core.exception;

/**
 * Region, forecast date, file, entity or target date does not exist.
 * Surfaced to clients as "not found" and never retried.
 */
public class ForecastNotFoundException extends ForecastException {

    public ForecastNotFoundException(String message) {
        super(message);
    }

    public ForecastNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
