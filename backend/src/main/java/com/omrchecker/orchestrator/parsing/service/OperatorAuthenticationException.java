package com.omrchecker.orchestrator.parsing.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.UNAUTHORIZED)
public class OperatorAuthenticationException extends RuntimeException {
    public OperatorAuthenticationException(String message) {
        super(message);
    }
}
