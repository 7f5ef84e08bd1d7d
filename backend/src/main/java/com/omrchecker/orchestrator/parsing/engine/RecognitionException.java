package com.omrchecker.orchestrator.parsing.engine;

public class RecognitionException extends Exception {
    public RecognitionException(String message) {
        super(message);
    }

    public RecognitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
