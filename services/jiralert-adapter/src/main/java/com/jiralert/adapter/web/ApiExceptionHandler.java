package com.jiralert.adapter.web;

import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import com.jiralert.adapter.integration.jira.TrackerRejectedException;
import com.jiralert.adapter.integration.jira.TrackerUnreachableException;
import com.jiralert.adapter.service.MalformedAlertException;
import com.jiralert.adapter.web.dto.IssuesResponse;

/**
 * Renders failures of the issues endpoints in the same shape as successful
 * responses. Malformed notifications are the caller's fault (400); anything
 * that went wrong talking to Jira is ours (500) so Alertmanager retries.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<IssuesResponse> handleInvalidPayload(WebExchangeBindException ex) {
        String detail = ex.getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining(", "));
        log.error("/issues, invalid notification: {}", detail);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(IssuesResponse.error("Invalid notification: " + detail));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<IssuesResponse> handleUnreadablePayload(ServerWebInputException ex) {
        log.error("/issues, unreadable notification: {}", ex.getReason());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(IssuesResponse.error("Unreadable notification: " + ex.getReason()));
    }

    @ExceptionHandler(MalformedAlertException.class)
    public ResponseEntity<IssuesResponse> handleMalformedAlert(MalformedAlertException ex) {
        log.error("/issues, {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(IssuesResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(TrackerRejectedException.class)
    public ResponseEntity<IssuesResponse> handleTrackerRejected(TrackerRejectedException ex) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(IssuesResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(TrackerUnreachableException.class)
    public ResponseEntity<IssuesResponse> handleTrackerUnreachable(TrackerUnreachableException ex) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(IssuesResponse.error(ex.getMessage()));
    }
}
