package com.makeitso.ledger.web;

import com.makeitso.ledger.auth.AuthenticationFailedException;
import com.makeitso.ledger.auth.EmailAlreadyRegisteredException;
import com.makeitso.ledger.auth.PasswordExpiredException;
import com.makeitso.ledger.session.SessionExpiredException;
import com.makeitso.ledger.session.SessionIntegrityException;
import jakarta.persistence.EntityNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Maps exceptions to {@link ErrorResponse}.
 *
 * Authentication and authorization failures carry fixed messages; which credential,
 * session or permission was at fault only goes to the log and the security events.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String DENIED_MESSAGE  = "You do not have permission to access this resource";
    static final String GENERIC_MESSAGE = "An unexpected error occurred";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException ex,
                                                                HttpServletRequest request) {
        List<ErrorResponse.ValidationError> validationErrors = ex.getBindingResult()
                .getAllErrors()
                .stream()
                .map(error -> ErrorResponse.ValidationError.builder()
                        .field(error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName())
                        .message(error.getDefaultMessage())
                        .build())
                .toList();

        ErrorResponse body = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Invalid request parameters",
                request.getRequestURI());
        body.setValidationErrors(validationErrors);
        log.warn("[Web] {} validation failures on {}", validationErrors.size(), request.getRequestURI());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("[Web] Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
        String message = ex instanceof IllegalArgumentException ? ex.getMessage() : "Malformed request";
        return respond(HttpStatus.BAD_REQUEST, message, request);
    }

    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<ErrorResponse> handleAuthenticationFailed(AuthenticationFailedException ex,
                                                                    HttpServletRequest request) {
        return respond(HttpStatus.UNAUTHORIZED, ex.getMessage(), request);
    }

    @ExceptionHandler(SessionExpiredException.class)
    public ResponseEntity<ErrorResponse> handleSessionExpired(SessionExpiredException ex,
                                                              HttpServletRequest request) {
        return respond(HttpStatus.UNAUTHORIZED, SessionExpiredException.MESSAGE, request);
    }

    @ExceptionHandler(SessionIntegrityException.class)
    public ResponseEntity<ErrorResponse> handleSessionIntegrity(SessionIntegrityException ex,
                                                                HttpServletRequest request) {
        log.error("[Web] Session integrity failure on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, SessionExpiredException.MESSAGE, request);
    }

    @ExceptionHandler(PasswordExpiredException.class)
    public ResponseEntity<ErrorResponse> handlePasswordExpired(PasswordExpiredException ex,
                                                               HttpServletRequest request) {
        return respond(HttpStatus.FORBIDDEN, ex.getMessage(), request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        return respond(HttpStatus.FORBIDDEN, DENIED_MESSAGE, request);
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(EmailAlreadyRegisteredException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(EmailAlreadyRegisteredException ex,
                                                         HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleConflict(IllegalStateException ex, HttpServletRequest request) {
        log.warn("[Web] Conflict on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), request);
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(OptimisticLockingFailureException ex,
                                                              HttpServletRequest request) {
        log.warn("[Web] Concurrent modification on {}", request.getRequestURI());
        return respond(HttpStatus.CONFLICT, "The resource was modified by another request. Please retry.", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("[Web] Unhandled error on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, GENERIC_MESSAGE, request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, HttpServletRequest request) {
        return ResponseEntity.status(status).body(ErrorResponse.of(status, message, request.getRequestURI()));
    }
}
