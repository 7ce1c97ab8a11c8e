package com.vet.scheduling.controller;

import com.vet.scheduling.calendar.SchedulingError;
import com.vet.scheduling.calendar.SchedulingException;
import com.vet.scheduling.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps scheduling outcomes to HTTP statuses. Messages never carry storage details.
 */
@RestControllerAdvice
public class SchedulingExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(SchedulingExceptionHandler.class);

    @ExceptionHandler(SchedulingException.class)
    public ResponseEntity<ErrorResponse> handleScheduling(SchedulingException e) {
        HttpStatus status = statusFor(e.getError());
        log.info("Scheduling request rejected: {} {}", e.getError(), e.getMessage());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (e.getError() == SchedulingError.BUSY) {
            builder.header(HttpHeaders.RETRY_AFTER, "1");
        }
        return builder.body(new ErrorResponse(e.getError().name(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_REQUEST", message));
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_REQUEST", "Malformed request body"));
    }

    static HttpStatus statusFor(SchedulingError error) {
        switch (error) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case SLOT_UNAVAILABLE:
            case CONCURRENT_MODIFICATION:
            case INVALID_TRANSITION:
                return HttpStatus.CONFLICT;
            case INVALID_DURATION:
            case INVALID_WINDOW:
            case OUTSIDE_AVAILABILITY:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case BUSY:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
