package com.delta.mailverify.pipeline.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidPipelineRequestException extends RuntimeException {
    public InvalidPipelineRequestException(String message) {
        super(message);
    }
}
