package com.delta.mailverify.pipeline.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
public class TenantQuotaExceededException extends RuntimeException {
    public TenantQuotaExceededException(String message) {
        super(message);
    }
}
