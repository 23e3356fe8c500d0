package io.nebula.identity.organization;

/**
 * Thrown when an organization insert hits a uniqueness constraint, which
 * means a concurrent request created the same organization first.
 */
public class DuplicateOrganizationException extends RuntimeException {

    public DuplicateOrganizationException(String message) {
        super(message);
    }

    public DuplicateOrganizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
