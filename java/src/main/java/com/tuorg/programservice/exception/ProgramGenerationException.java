package com.tuorg.programservice.exception;

/** A generate call that could not produce and persist a program. */
public class ProgramGenerationException extends RuntimeException {

    public ProgramGenerationException(String message) {
        super(message);
    }

    public ProgramGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
