package com.tuorg.programservice.exception;

/** LLM-assisted exercise selection failed. Always recovered by the deterministic strategy. */
public class ExerciseSelectionException extends RuntimeException {

    public ExerciseSelectionException(String message) {
        super(message);
    }

    public ExerciseSelectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
