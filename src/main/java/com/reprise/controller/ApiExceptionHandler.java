package com.reprise.controller;

import com.reprise.exception.CacheDeserializationException;
import com.reprise.exception.CacheException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps cache failures to RFC 7807 problem details.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(CacheDeserializationException.class)
    public ProblemDetail handleDeserialization(CacheDeserializationException e) {
        ProblemDetail pd = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        pd.setTitle("invalid_cache_entry");
        pd.setDetail(e.getMessage());
        if (e.getSource() != null) {
            pd.setProperty("source", e.getSource());
        }
        if (e.getRecord() != null) {
            pd.setProperty("record", e.getRecord());
        }

        log.info("Rejected cache entry: {}", e.getMessage());
        return pd;
    }

    @ExceptionHandler(CacheException.class)
    public ProblemDetail handleCache(CacheException e) {
        ProblemDetail pd = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
        pd.setTitle("cache_error");
        pd.setDetail(e.getMessage());
        pd.setProperty("type", e.getClass().getSimpleName());

        log.error("Cache error", e);
        return pd;
    }

    @ExceptionHandler(ErrorResponseException.class)
    public ProblemDetail handleSpringErrorResponse(ErrorResponseException e) {
        // Malformed bodies and unknown routes arrive here with a body already built
        ProblemDetail pd = e.getBody();
        if (pd.getStatus() >= 500) {
            log.error("Request failed with status {}", pd.getStatus(), e);
        } else {
            log.info("Client error {}: {}", pd.getStatus(), pd.getDetail());
        }
        return pd;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception e) {
        ProblemDetail pd = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
        pd.setTitle("internal_error");
        pd.setDetail("Unexpected server error");

        log.error("Unexpected error", e);
        return pd;
    }
}
