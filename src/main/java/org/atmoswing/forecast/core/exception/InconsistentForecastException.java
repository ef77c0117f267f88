package org.atmoswing.forecast.core.exception;

/**
 * Files that must agree (station ids, target dates, lead times) do not.
 * Points at corrupted upstream data; fatal for the request.
 */
public class InconsistentForecastException extends ForecastException {

    public InconsistentForecastException(String message) {
        super(message);
    }
}
