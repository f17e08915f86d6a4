package org.regdesk.registration.exception;

/**
 * Raised when loaded registration data does not honour the ordering contract
 * of the loader, e.g. participant rows of one race are not contiguous or a flag
 * vector does not line up with its race's special categories.
 * <p>
 * This is a defect in the loaded data or the queries, never a user error.
 */
public class RegistrationInvariantException extends RuntimeException {

    public RegistrationInvariantException(String message) {
        super(message);
    }
}
