package com.tuorg.programservice.exception;

/** Atomic creation failed; the repository guarantees no partial rows were kept. */
public class ProgramPersistenceException extends ProgramGenerationException {

    public ProgramPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
