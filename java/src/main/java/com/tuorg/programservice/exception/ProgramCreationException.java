package com.tuorg.programservice.exception;

/**
 * Raised by a {@code ProgramRepository} when an atomic program + weeks +
 * workouts insert cannot be committed as a whole.
 */
public class ProgramCreationException extends RuntimeException {

    public ProgramCreationException(String message) {
        super(message);
    }

    public ProgramCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
