package com.conversio.service.core.funnel.query;

/** Event storage timed out or was temporarily unavailable; the query may be retried. */
public class FunnelStorageTimeoutException extends IllegalStateException {

    public FunnelStorageTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
