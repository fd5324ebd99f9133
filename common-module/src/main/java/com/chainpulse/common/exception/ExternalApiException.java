package com.chainpulse.common.exception;

/**
 * Failure of a collaborator outside the service boundary (warehouse, cache backend).
 */
public class ExternalApiException extends BusinessException {
	
	public ExternalApiException(String message) {
		super(message);
	}
	
	public ExternalApiException(String message, Throwable cause) {
		super(message, cause);
	}
}
