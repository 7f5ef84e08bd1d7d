package com.omrchecker.orchestrator.parsing.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class SheetParsingException extends RuntimeException {
    public SheetParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
