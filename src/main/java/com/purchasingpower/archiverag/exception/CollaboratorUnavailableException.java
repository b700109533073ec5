package com.purchasingpower.archiverag.exception;

import com.purchasingpower.archiverag.model.ServiceType;
import lombok.Getter;

/**
 * A required collaborator (entity store, vector index, model, source) could not be reached.
 * Never reported to callers as "no evidence".
 */
@Getter
public class CollaboratorUnavailableException extends RuntimeException {

    private final ServiceType service;

    public CollaboratorUnavailableException(ServiceType service, String message) {
        super(message);
        this.service = service;
    }

    public CollaboratorUnavailableException(ServiceType service, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
    }
}
