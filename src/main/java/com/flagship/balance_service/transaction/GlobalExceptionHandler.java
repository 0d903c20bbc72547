package com.flagship.balance_service.transaction;

import com.flagship.balance_service.observability.RequestIdContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Catches runtime exceptions that escape a handler. Framework errors such as
 * an unsupported method keep their default handling.
 *
 * Business outcomes never arrive here; they are rendered by the controller.
 * Anything that does is a defect and is reported as 500 with the request id
 * so the caller can quote it.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<String> handleUnexpected(RuntimeException e, HttpServletRequest request) {
        log.error("Unexpected error", e);

        String requestId = RequestIdContext.get(request);
        String body = requestId.isEmpty()
                ? "internal error"
                : "internal error, request id: " + requestId;

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.TEXT_PLAIN)
                .body(body);
    }
}
