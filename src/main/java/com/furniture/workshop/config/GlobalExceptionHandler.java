package com.furniture.workshop.config;

import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.util.Messages;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Faults that escape the service boundary. Business failures never get here,
 * they come back as failed {@link OperationResult}s.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final Messages messages;

    public GlobalExceptionHandler(Messages messages) {
        this.messages = messages;
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class, MissingRequestHeaderException.class })
    public ResponseEntity<OperationResult<Void>> handleBadRequest(HttpServletRequest request, Exception ex) {
        logger.info("Malformed request to {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest().body(OperationResult.failure(messages.get("error.bad-request")));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<OperationResult<Void>> handleAccessDenied(HttpServletRequest request,
            AccessDeniedException ex) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(OperationResult.failure(messages.get("error.forbidden")));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<OperationResult<Void>> handleException(HttpServletRequest request, Exception ex) {
        logger.error("Unhandled error on {}", request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(OperationResult.failure(messages.get("error.generic")));
    }
}
