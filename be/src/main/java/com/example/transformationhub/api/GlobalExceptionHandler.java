package com.example.transformationhub.api;

import com.example.transformationhub.codegen.ConcurrentRevisionModificationException;
import com.example.transformationhub.codegen.InconsistentStoredGraphException;
import com.example.transformationhub.codegen.UnresolvedDependencyException;
import com.example.transformationhub.lifecycle.LifecycleException;
import com.example.transformationhub.lifecycle.RevisionInUseException;
import com.example.transformationhub.nesting.UnboundedNestingException;
import com.example.transformationhub.service.TransformationAlreadyExistsException;
import com.example.transformationhub.validation.ValidationError;
import com.example.transformationhub.validation.WorkflowGraphValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Central exception handling for the REST API.
 * <p>
 * Maps core failures to HTTP status and {@link ErrorResponse} body: not found → 404,
 * validation → 400 with {@code errors}, lifecycle → 403, in use / already exists / concurrent
 * modification → 409, unresolved dependency → 424, nesting defects and broken stored graphs → 500. No stack traces in
 * responses.
 * </p>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(TransformationNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(TransformationNotFoundException ex) {
        log.warn("Transformation revision not found: {}", ex.getTransformationId());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(WorkflowGraphValidationException.class)
    public ResponseEntity<ErrorResponse> handleGraphValidation(WorkflowGraphValidationException ex) {
        log.warn("Transformation revision validation failed: {} errors={}", ex.getMessage(), ex.getErrors().size());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.withErrors(ex.getMessage(), ex.getErrors()));
    }

    @ExceptionHandler(LifecycleException.class)
    public ResponseEntity<ErrorResponse> handleLifecycle(LifecycleException ex) {
        log.warn("Lifecycle rejected write current={} requested={}", ex.getCurrentState(), ex.getRequestedState());
        return ResponseEntity
                .status(HttpStatus.FORBIDDEN)
                .body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(RevisionInUseException.class)
    public ResponseEntity<ErrorResponse> handleInUse(RevisionInUseException ex) {
        log.warn("Revision in use id={} usedBy={}", ex.getRevisionId(), ex.getUsedBy());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(TransformationAlreadyExistsException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyExists(TransformationAlreadyExistsException ex) {
        log.warn("Transformation revision already exists: {}", ex.getTransformationId());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(ConcurrentRevisionModificationException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentModification(ConcurrentRevisionModificationException ex) {
        log.warn("Concurrent modification of revision {}", ex.getRevisionId());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(ErrorResponse.retryable(ex.getMessage()));
    }

    @ExceptionHandler(UnresolvedDependencyException.class)
    public ResponseEntity<ErrorResponse> handleUnresolvedDependency(UnresolvedDependencyException ex) {
        log.warn("Unresolved dependency operatorId={} transformationId={}", ex.getOperatorId(), ex.getTransformationId());
        return ResponseEntity
                .status(HttpStatus.FAILED_DEPENDENCY)
                .body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(UnboundedNestingException.class)
    public ResponseEntity<ErrorResponse> handleUnboundedNesting(UnboundedNestingException ex) {
        log.error("Nesting defect for workflow {}: {}", ex.getWorkflowId(), ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(InconsistentStoredGraphException.class)
    public ResponseEntity<ErrorResponse> handleInconsistentStoredGraph(InconsistentStoredGraphException ex) {
        log.error("Stored graph defect during compilation: {} cyclePath={}", ex.getMessage(), ex.getCyclePath());
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException ex) {
        List<ValidationError> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> new ValidationError(fe.getField(), fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid"))
                .collect(Collectors.toList());
        log.warn("Bean validation failed: {} field errors", errors.size());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.withErrors("Validation failed", errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("Malformed transformation revision"));
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleIllegalArgument(RuntimeException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ex.getMessage() != null ? ex.getMessage() : "Invalid request"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(NoResourceFoundException ex) {
        log.debug("Static resource not found: {}", ex.getResourcePath());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("Not found: " + ex.getResourcePath()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("An error occurred while processing the transformation revision"));
    }
}
