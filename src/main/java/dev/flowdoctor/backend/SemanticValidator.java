package dev.flowdoctor.backend;

/**
 * The authoritative external validator for flow documents.
 */
public interface SemanticValidator {

    /**
     * Validate a serialized flow document.
     *
     * @throws AuthenticationException  when the credentials are rejected
     * @throws ExternalServiceException when the validator cannot be reached or answers garbage
     */
    ValidationResponse validate(String csv, Credentials credentials);
}
