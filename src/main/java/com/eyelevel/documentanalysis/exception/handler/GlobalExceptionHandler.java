package com.eyelevel.documentanalysis.exception.handler;

import com.eyelevel.documentanalysis.dto.common.ApiResponse;
import com.eyelevel.documentanalysis.exception.AnalysisFailedException;
import com.eyelevel.documentanalysis.exception.DocumentAnalysisException;
import com.eyelevel.documentanalysis.exception.ExtractionFailedException;
import com.eyelevel.documentanalysis.exception.RunAlreadyExistsException;
import com.eyelevel.documentanalysis.exception.RunNotFoundException;
import com.eyelevel.documentanalysis.exception.StatusConflictException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A centralized exception handler for the entire application.
 * It intercepts exceptions thrown from controllers and converts them into a
 * standardized ApiResponse format with the semantically correct HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Handles business errors without a more specific mapping, including unsupported model variants. (400 Bad Request)
     */
    @ExceptionHandler(DocumentAnalysisException.class)
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(DocumentAnalysisException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error("Malformed request body.",
                                                         "The request body is missing or could not be parsed.");
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingServletRequestParameter(
            MissingServletRequestParameterException ex) {
        String errorMessage = String.format("Required parameter '%s' of type '%s' is missing.", ex.getParameterName(),
                                            ex.getParameterType());
        log.warn("Handling MissingServletRequestParameterException: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Required parameter is missing.", errorMessage),
                                    HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Valid on request bodies. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                          .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                          .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Invalid input provided.", errorMessage),
                                    HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Validated on path variables and request parameters. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream().map(violation -> {
            String path = violation.getPropertyPath().toString();
            return String.format("'%s': %s", path.substring(path.lastIndexOf('.') + 1), violation.getMessage());
        }).collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Invalid input provided.", errorMessage),
                                    HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String errorMessage = String.format("Invalid value '%s' for parameter '%s'. Expected type '%s'.", ex.getValue(),
                                            ex.getName(), ex.getRequiredType() != null
                                                    ? ex.getRequiredType().getSimpleName()
                                                    : String.valueOf(ex.getRequiredType()));
        log.warn("Handling type mismatch exception: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Invalid parameter type provided.", errorMessage),
                                    HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles unknown runs. (404 Not Found)
     */
    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNotFound(RunNotFoundException ex) {
        log.warn("Run Not Found Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(
            HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = String.join(", ", Objects.requireNonNull(ex.getSupportedMethods()));
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s",
                                            ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Method not allowed.", errorMessage),
                                    HttpStatus.METHOD_NOT_ALLOWED);
    }

    /**
     * Handles duplicate run identifiers. (409 Conflict)
     */
    @ExceptionHandler(RunAlreadyExistsException.class)
    public ResponseEntity<ApiResponse<Object>> handleAlreadyExists(RunAlreadyExistsException ex) {
        log.warn("Run Already Exists Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), HttpStatus.CONFLICT);
    }

    /**
     * Handles requests that do not fit the current run state, such as analysis before extraction. (409 Conflict)
     */
    @ExceptionHandler(StatusConflictException.class)
    public ResponseEntity<ApiResponse<Object>> handleStatusConflict(StatusConflictException ex) {
        log.warn("Status Conflict Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ex.getCurrentStatus() != null
                ? ApiResponse.error(ex.getMessage(), ex.getCurrentStatus().name())
                : ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.CONFLICT);
    }

    // --- 5xx Server Error Handlers ---

    /**
     * Handles failures of the OCR or model engines that surface directly to a caller. (502 Bad Gateway)
     */
    @ExceptionHandler({ExtractionFailedException.class, AnalysisFailedException.class})
    public ResponseEntity<ApiResponse<Object>> handleBadGateway(DocumentAnalysisException ex) {
        log.error("Engine failure: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), HttpStatus.BAD_GATEWAY);
    }

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        ApiResponse<Object> response = ApiResponse.error(
                "An unexpected internal error occurred. Please contact support.", ex.getClass().getSimpleName());
        return new ResponseEntity<>(response, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
