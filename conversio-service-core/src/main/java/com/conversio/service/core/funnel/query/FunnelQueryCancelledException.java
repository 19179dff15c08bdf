package com.conversio.service.core.funnel.query;

public class FunnelQueryCancelledException extends IllegalStateException {

    public FunnelQueryCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
