package com.xammer.anomaly.exception;

/**
 * Raised when the anomaly listing cannot be completed. An aggregation run that throws this
 * produces no report.
 */
public class AnomalyRetrievalException extends RuntimeException {

    public AnomalyRetrievalException(String message) {
        super(message);
    }

    public AnomalyRetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
