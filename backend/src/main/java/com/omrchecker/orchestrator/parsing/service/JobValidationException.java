package com.omrchecker.orchestrator.parsing.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class JobValidationException extends RuntimeException {
    public JobValidationException(String message) {
        super(message);
    }
}
