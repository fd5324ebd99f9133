package com.chainpulse.common.exception;

import com.chainpulse.common.dto.ErrorResponseDTO;
import com.chainpulse.common.util.SensitiveDataFilter;
import io.swagger.v3.oas.annotations.Hidden;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.LocalDateTime;

@RestControllerAdvice
@Order(1) // Lower priority to let SpringDoc handle its own exceptions first
@Hidden
@Slf4j
public class GlobalExceptionHandler {

	private static final String URI_PREFIX = "uri=";
	private static final String UNKNOWN_PATH = "unknown";
	private static final String FAVICON_PATH = "favicon.ico";
	private static final String SPRINGDOC_API_DOCS_PATH = "/v3/api-docs";
	private static final String SPRINGDOC_SWAGGER_UI_PATH = "/swagger-ui";

	private static final String VALIDATION_FAILED_MESSAGE = "Validation failed";
	private static final String UNEXPECTED_ERROR_MESSAGE = "An unexpected error occurred";
	private static final String INVALID_ARGUMENT_MESSAGE = "Invalid argument provided";
	private static final String MALFORMED_BODY_MESSAGE = "Request body is missing or malformed";
	private static final String COMPUTE_FAILED_MESSAGE = "Analytics computation failed, please retry the request";

	private static final String ERROR_CODE_NOT_FOUND = "NOT_FOUND";
	private static final String ERROR_CODE_COMPUTE_ERROR = "COMPUTE_ERROR";
	private static final String ERROR_CODE_EXTERNAL_API_ERROR = "EXTERNAL_API_ERROR";
	private static final String ERROR_CODE_TIMEOUT = "TIMEOUT";
	private static final String ERROR_CODE_BUSINESS_ERROR = "BUSINESS_ERROR";
	private static final String ERROR_CODE_VALIDATION_ERROR = "VALIDATION_ERROR";
	private static final String ERROR_CODE_MALFORMED_REQUEST = "MALFORMED_REQUEST";
	private static final String ERROR_CODE_INVALID_ARGUMENT = "INVALID_ARGUMENT";
	private static final String ERROR_CODE_METHOD_NOT_ALLOWED = "METHOD_NOT_ALLOWED";
	private static final String ERROR_CODE_INTERNAL_ERROR = "INTERNAL_ERROR";

	private static final int MAX_MESSAGE_LENGTH = 200;
	private static final String MESSAGE_TRUNCATION_SUFFIX = "...";

	@ExceptionHandler(NotFoundException.class)
	public ResponseEntity<ErrorResponseDTO> handleNotFoundException(NotFoundException ex, WebRequest request) {
		log.warn("Resource not found: {}", ex.getMessage());
		return buildErrorResponse(ERROR_CODE_NOT_FOUND, ex.getMessage(), HttpStatus.NOT_FOUND, request);
	}

	@ExceptionHandler(ComputeException.class)
	public ResponseEntity<ErrorResponseDTO> handleComputeException(ComputeException ex, WebRequest request) {
		log.error("Compute failed for adapter={}: {}", ex.getAdapter(), sanitizeMessage(ex.getMessage()));
		return buildErrorResponse(ERROR_CODE_COMPUTE_ERROR, COMPUTE_FAILED_MESSAGE, HttpStatus.SERVICE_UNAVAILABLE, request);
	}

	@ExceptionHandler(ExternalApiException.class)
	public ResponseEntity<ErrorResponseDTO> handleExternalApiException(ExternalApiException ex, WebRequest request) {
		String sanitizedMessage = sanitizeMessage(ex.getMessage());
		log.error("External dependency error: {}", sanitizedMessage);
		return buildErrorResponse(ERROR_CODE_EXTERNAL_API_ERROR, sanitizedMessage, HttpStatus.SERVICE_UNAVAILABLE, request);
	}

	@ExceptionHandler(QueryTimeoutException.class)
	public ResponseEntity<ErrorResponseDTO> handleQueryTimeoutException(QueryTimeoutException ex, WebRequest request) {
		log.warn("Query wait timed out: {}", ex.getMessage());
		return buildErrorResponse(ERROR_CODE_TIMEOUT, ex.getMessage(), HttpStatus.GATEWAY_TIMEOUT, request);
	}

	@ExceptionHandler(BusinessException.class)
	public ResponseEntity<ErrorResponseDTO> handleBusinessException(BusinessException ex, WebRequest request) {
		log.error("Business error: {}", ex.getMessage());
		return buildErrorResponse(ERROR_CODE_BUSINESS_ERROR, ex.getMessage(), HttpStatus.BAD_REQUEST, request);
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ResponseEntity<ErrorResponseDTO> handleValidationException(MethodArgumentNotValidException ex, WebRequest request) {
		log.debug("Validation error: {}", ex.getMessage());
		String message = ex.getBindingResult().getFieldErrors().stream()
			.map(error -> String.format("%s: %s", error.getField(), error.getDefaultMessage()))
			.reduce((a, b) -> String.format("%s, %s", a, b))
			.orElse(VALIDATION_FAILED_MESSAGE);

		return buildErrorResponse(ERROR_CODE_VALIDATION_ERROR, message, HttpStatus.BAD_REQUEST, request);
	}

	@ExceptionHandler(HttpMessageNotReadableException.class)
	public ResponseEntity<ErrorResponseDTO> handleHttpMessageNotReadableException(HttpMessageNotReadableException ex, WebRequest request) {
		log.debug("Unreadable request body: {}", ex.getMessage());
		return buildErrorResponse(ERROR_CODE_MALFORMED_REQUEST, MALFORMED_BODY_MESSAGE, HttpStatus.BAD_REQUEST, request);
	}

	@ExceptionHandler(IllegalArgumentException.class)
	public ResponseEntity<ErrorResponseDTO> handleIllegalArgumentException(IllegalArgumentException ex, WebRequest request) {
		log.debug("Illegal argument: {}", ex.getMessage());
		String message = ex.getMessage() != null ? ex.getMessage() : INVALID_ARGUMENT_MESSAGE;
		return buildErrorResponse(ERROR_CODE_INVALID_ARGUMENT, message, HttpStatus.BAD_REQUEST, request);
	}

	@ExceptionHandler(HttpRequestMethodNotSupportedException.class)
	public ResponseEntity<ErrorResponseDTO> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex, WebRequest request) {
		return buildErrorResponse(ERROR_CODE_METHOD_NOT_ALLOWED, ex.getMessage(), HttpStatus.METHOD_NOT_ALLOWED, request);
	}

	@ExceptionHandler(NoResourceFoundException.class)
	public ResponseEntity<?> handleNoResourceFoundException(NoResourceFoundException ex, WebRequest request) {
		String path = extractPath(request);

		// Browsers ask for it on their own
		if (path.contains(FAVICON_PATH)) {
			log.debug("Favicon not found: {}", path);
			return ResponseEntity.notFound().build();
		}

		if (isSpringDocPath(path)) {
			log.debug("SpringDoc path not found: {}", path);
			return ResponseEntity.notFound().build();
		}

		log.warn("Resource not found: {}", path);
		return buildErrorResponse(ERROR_CODE_NOT_FOUND, ex.getMessage(), HttpStatus.NOT_FOUND, request);
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ErrorResponseDTO> handleGenericException(Exception ex, WebRequest request) {
		// Never leak internals to the client
		String errorMessage = truncateMessage(sanitizeMessage(ex.getMessage()));

		log.error("Unexpected error: {}", errorMessage != null ? errorMessage : ex.getClass().getSimpleName(), ex);
		return buildErrorResponse(ERROR_CODE_INTERNAL_ERROR, UNEXPECTED_ERROR_MESSAGE, HttpStatus.INTERNAL_SERVER_ERROR, request);
	}

	private ResponseEntity<ErrorResponseDTO> buildErrorResponse(String errorCode, String message,
	                                                             HttpStatus status, WebRequest request) {
		ErrorResponseDTO error = ErrorResponseDTO.builder()
			.errorCode(errorCode)
			.message(message)
			.timestamp(LocalDateTime.now())
			.path(extractPath(request))
			.build();
		return new ResponseEntity<>(error, status);
	}

	private String extractPath(WebRequest request) {
		try {
			String description = request.getDescription(false);
			if (StringUtils.isEmpty(description)) {
				return UNKNOWN_PATH;
			}
			return description.replace(URI_PREFIX, "");
		} catch (RuntimeException e) {
			log.warn("Failed to extract path from request", e);
			return UNKNOWN_PATH;
		}
	}

	private boolean isSpringDocPath(String path) {
		return path.contains(SPRINGDOC_API_DOCS_PATH) || path.contains(SPRINGDOC_SWAGGER_UI_PATH);
	}

	private String truncateMessage(String message) {
		if (message == null) {
			return null;
		}
		if (message.length() > MAX_MESSAGE_LENGTH) {
			return message.substring(0, MAX_MESSAGE_LENGTH) + MESSAGE_TRUNCATION_SUFFIX;
		}
		return message;
	}

	/**
	 * Masks credentials, then truncates.
	 */
	private String sanitizeMessage(String message) {
		if (message == null) {
			return null;
		}
		return truncateMessage(SensitiveDataFilter.maskSensitiveData(message));
	}
}
