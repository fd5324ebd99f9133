package com.chainpulse.common.exception;

/**
 * The caller stopped waiting for a shared computation. The computation itself keeps running.
 */
public class QueryTimeoutException extends BusinessException {
	
	public QueryTimeoutException(String message) {
		super(message);
	}
	
	public QueryTimeoutException(String message, Throwable cause) {
		super(message, cause);
	}
}
