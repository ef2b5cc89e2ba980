package com.cred.freestyle.groupbuy.api.exception;

import com.cred.freestyle.groupbuy.api.dto.ErrorResponse;
import com.cred.freestyle.groupbuy.exception.*;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the group-buy API.
 * Converts every failure into an ErrorResponse carrying a stable details.code.
 *
 * @author Group Buy Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Returns 401 UNAUTHORIZED for missing or bad credentials.
     */
    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthenticatedException(
            UnauthenticatedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Unauthenticated: {}", ex.getMessage());
        return build("Unauthenticated", ex.getMessage(), ErrorCode.UNAUTHENTICATED, request);
    }

    /**
     * Returns 403 FORBIDDEN when a member-only operation is attempted by a non-member.
     */
    @ExceptionHandler(NotGroupMemberException.class)
    public ResponseEntity<ErrorResponse> handleNotGroupMemberException(
            NotGroupMemberException ex,
            HttpServletRequest request
    ) {
        logger.warn("Not a group member: {}", ex.getMessage());
        ResponseEntity<ErrorResponse> response = build("Forbidden",
                "Must be a group member to perform this action", ErrorCode.FORBIDDEN, request);
        response.getBody().withDetail("groupId", ex.getGroupId());
        return response;
    }

    /**
     * Returns 403 FORBIDDEN when the caller lacks the required role.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Access denied on {}: {}", request.getRequestURI(), ex.getMessage());
        return build("Forbidden", ex.getMessage(), ErrorCode.FORBIDDEN, request);
    }

    /**
     * Returns 404 NOT FOUND when a group, offer or user doesn't exist.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());
        ResponseEntity<ErrorResponse> response = build("Resource Not Found",
                ex.getMessage(), ErrorCode.NOT_FOUND, request);
        response.getBody()
                .withDetail("resourceType", ex.getResourceType())
                .withDetail("resourceId", ex.getResourceId());
        return response;
    }

    /**
     * Returns 402 PAYMENT REQUIRED when joining without a paid fee.
     */
    @ExceptionHandler(PaymentRequiredException.class)
    public ResponseEntity<ErrorResponse> handlePaymentRequiredException(
            PaymentRequiredException ex,
            HttpServletRequest request
    ) {
        logger.warn("Payment required: {}", ex.getMessage());
        ResponseEntity<ErrorResponse> response = build("Payment Required",
                ex.getMessage(), ErrorCode.PAYMENT_REQUIRED, request);
        response.getBody().withDetail("groupId", ex.getGroupId());
        return response;
    }

    @ExceptionHandler(AlreadyMemberException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyMemberException(
            AlreadyMemberException ex,
            HttpServletRequest request
    ) {
        logger.warn("Already a member: {}", ex.getMessage());
        ResponseEntity<ErrorResponse> response = build("Already a Member",
                "Already a member of this group", ErrorCode.ALREADY_MEMBER, request);
        response.getBody().withDetail("groupId", ex.getGroupId());
        return response;
    }

    @ExceptionHandler(AlreadyPaidException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyPaidException(
            AlreadyPaidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Already paid: {}", ex.getMessage());
        ResponseEntity<ErrorResponse> response = build("Already Paid",
                ex.getMessage(), ErrorCode.ALREADY_PAID, request);
        response.getBody().withDetail("groupId", ex.getGroupId());
        return response;
    }

    @ExceptionHandler(GroupFullException.class)
    public ResponseEntity<ErrorResponse> handleGroupFullException(
            GroupFullException ex,
            HttpServletRequest request
    ) {
        logger.warn("Group full: {}", ex.getMessage());
        ResponseEntity<ErrorResponse> response = build("Group Full",
                ex.getMessage(), ErrorCode.GROUP_FULL, request);
        response.getBody()
                .withDetail("groupId", ex.getGroupId())
                .withDetail("maxMembers", ex.getMaxMembers());
        return response;
    }

    /**
     * Returns 409 CONFLICT when the group's lifecycle status doesn't allow the operation.
     */
    @ExceptionHandler(InvalidGroupStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidGroupStateException(
            InvalidGroupStateException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid group state: {}", ex.getMessage());
        ResponseEntity<ErrorResponse> response = build("Invalid Group State",
                ex.getMessage(), ErrorCode.INVALID_STATE, request);
        response.getBody()
                .withDetail("groupId", ex.getGroupId())
                .withDetail("currentStatus", ex.getCurrentStatus() != null ? ex.getCurrentStatus().name() : null);
        return response;
    }

    @ExceptionHandler(EmailAlreadyRegisteredException.class)
    public ResponseEntity<ErrorResponse> handleEmailAlreadyRegisteredException(
            EmailAlreadyRegisteredException ex,
            HttpServletRequest request
    ) {
        logger.warn("Registration rejected: {}", ex.getMessage());
        return build("Email Already Registered", ex.getMessage(),
                ErrorCode.EMAIL_ALREADY_REGISTERED, request);
    }

    /**
     * Returns 409 CONFLICT once lock contention retries are exhausted.
     */
    @ExceptionHandler(StoreContentionException.class)
    public ResponseEntity<ErrorResponse> handleStoreContentionException(
            StoreContentionException ex,
            HttpServletRequest request
    ) {
        logger.warn("Store contention: {}", ex.getMessage());
        ResponseEntity<ErrorResponse> response = build("Concurrent Update",
                ex.getMessage(), ErrorCode.STORE_CONTENTION, request);
        response.getBody().withDetail("attempts", ex.getAttempts());
        return response;
    }

    /**
     * Returns 400 BAD REQUEST for invalid arguments.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal argument: {}", ex.getMessage());
        return build("Invalid Argument", ex.getMessage(), ErrorCode.VALIDATION_FAILED,
                request);
    }

    /**
     * Returns 400 BAD REQUEST for unreadable JSON bodies.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotReadableException(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Unreadable request body on {}", request.getRequestURI());
        return build("Malformed Request", "Request body is missing or malformed",
                ErrorCode.VALIDATION_FAILED, request);
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }

        ResponseEntity<ErrorResponse> response = build("Validation Failed",
                "Request validation failed. Please check the field errors.", ErrorCode.VALIDATION_FAILED, request);
        response.getBody().withDetail("fieldErrors", fieldErrors);
        return response;
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR without internal details.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);
        return build("Internal Server Error",
                "An unexpected error occurred. Please try again later.", ErrorCode.INTERNAL_ERROR, request);
    }

    private ResponseEntity<ErrorResponse> build(
            String title,
            String message,
            ErrorCode code,
            HttpServletRequest request
    ) {
        ErrorResponse error = ErrorResponse.of(code, title, message, request.getRequestURI());
        return ResponseEntity.status(code.getHttpStatus()).body(error);
    }
}
