package com.dispatchqueue.core;

/**
 * Thrown when a job creation request is missing required data or carries invalid values.
 *
 * <p>The job is never persisted when this is raised. The message names the offending field
 * so that webhook and command producers can report it back verbatim.</p>
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String message) {
        super(message);
        this.field = null;
    }

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * Get the name of the invalid field.
     *
     * @return the field name, or null when the error is not tied to one field
     */
    public String getField() {
        return field;
    }
}
