package com.purchasingpower.archiverag.exception;

import lombok.Getter;

@Getter
public class QueryTimeoutException extends RuntimeException {

    private final String queryId;
    private final int timeoutSeconds;

    public QueryTimeoutException(String queryId, int timeoutSeconds) {
        super("Query " + queryId + " exceeded the time limit of " + timeoutSeconds + " seconds");
        this.queryId = queryId;
        this.timeoutSeconds = timeoutSeconds;
    }
}
