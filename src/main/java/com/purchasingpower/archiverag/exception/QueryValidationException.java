package com.purchasingpower.archiverag.exception;

import lombok.Getter;

/**
 * Query text rejected before any collaborator was called.
 */
@Getter
public class QueryValidationException extends RuntimeException {

    private final String input;

    public QueryValidationException(String message, String input) {
        super(message);
        this.input = input;
    }
}
