package dev.flowdoctor.backend;

import java.util.Optional;

/**
 * A collaborator could not be reached, timed out or answered with an error status.
 */
public class ExternalServiceException extends RuntimeException {

    private final String service;
    private final Integer status;

    public ExternalServiceException(String service, String message) {
        this(service, null, message, null);
    }

    public ExternalServiceException(String service, Integer status, String message, Throwable cause) {
        super(service + ": " + message, cause);
        this.service = service;
        this.status = status;
    }

    public String service() {
        return service;
    }

    /** HTTP status, when the failure came with one. */
    public Optional<Integer> status() {
        return Optional.ofNullable(status);
    }
}
