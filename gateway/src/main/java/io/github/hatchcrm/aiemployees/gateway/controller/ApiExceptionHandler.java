package io.github.hatchcrm.aiemployees.gateway.controller;

import io.github.hatchcrm.aiemployees.runtime.error.AiEmployeeException;
import io.github.hatchcrm.aiemployees.runtime.error.BadRequestException;
import io.github.hatchcrm.aiemployees.runtime.error.ForbiddenException;
import io.github.hatchcrm.aiemployees.runtime.error.InvalidStateException;
import io.github.hatchcrm.aiemployees.runtime.error.ModelUnavailableException;
import io.github.hatchcrm.aiemployees.runtime.error.NotFoundException;
import io.github.hatchcrm.aiemployees.runtime.error.RateLimitExceededException;
import io.github.hatchcrm.aiemployees.runtime.error.ToolExecutionException;
import io.github.hatchcrm.aiemployees.runtime.error.ToolValidationException;
import io.github.hatchcrm.aiemployees.runtime.error.UnknownToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps orchestration failures to {@code {error, message}} bodies. Per-action failures never get
 * here; they are stored on the action.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AiEmployeeException.class)
    public ResponseEntity<Map<String, Object>> handle(AiEmployeeException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.warn("{} -> {}: {}", ex.getClass().getSimpleName(), status.value(), ex.getMessage());
        } else {
            log.debug("{} -> {}: {}", ex.getClass().getSimpleName(), status.value(), ex.getMessage());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", errorCode(status));
        body.put("message", ex.getMessage());
        if (ex instanceof ToolValidationException validation) {
            body.put("details", validation.getErrors());
        }
        return new ResponseEntity<>(body, status);
    }

    static HttpStatus statusFor(AiEmployeeException ex) {
        if (ex instanceof ForbiddenException) return HttpStatus.FORBIDDEN;
        if (ex instanceof NotFoundException) return HttpStatus.NOT_FOUND;
        if (ex instanceof ToolValidationException) return HttpStatus.UNPROCESSABLE_ENTITY;
        if (ex instanceof RateLimitExceededException) return HttpStatus.TOO_MANY_REQUESTS;
        if (ex instanceof ToolExecutionException) return HttpStatus.BAD_GATEWAY;
        if (ex instanceof ModelUnavailableException) return HttpStatus.SERVICE_UNAVAILABLE;
        if (ex instanceof BadRequestException || ex instanceof InvalidStateException
                || ex instanceof UnknownToolException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static String errorCode(HttpStatus status) {
        return status.name().toLowerCase();
    }
}
