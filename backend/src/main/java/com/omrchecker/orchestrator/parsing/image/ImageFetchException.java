package com.omrchecker.orchestrator.parsing.image;

public class ImageFetchException extends Exception {
    public ImageFetchException(String message) {
        super(message);
    }

    public ImageFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
