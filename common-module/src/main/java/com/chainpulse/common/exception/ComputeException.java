package com.chainpulse.common.exception;

import lombok.Getter;

/**
 * Raised when a compute adapter fails against the warehouse, or when a coalesced
 * computation is still failing after its last attempt.
 */
@Getter
public class ComputeException extends ExternalApiException {
	
	private final String adapter;
	
	public ComputeException(String adapter, String message) {
		super(message);
		this.adapter = adapter;
	}
	
	public ComputeException(String adapter, String message, Throwable cause) {
		super(message, cause);
		this.adapter = adapter;
	}
}
