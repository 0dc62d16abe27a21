package dev.flowdoctor.backend;

/**
 * The collaborator rejected the session credentials (HTTP 401).
 */
public class AuthenticationException extends ExternalServiceException {

    public static final int UNAUTHORIZED = 401;

    public AuthenticationException(String service, String message, Throwable cause) {
        super(service, UNAUTHORIZED, message, cause);
    }
}
