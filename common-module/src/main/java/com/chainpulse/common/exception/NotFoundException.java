package com.chainpulse.common.exception;

public class NotFoundException extends BusinessException {
	
	public NotFoundException(String message) {
		super(message);
	}
	
	public NotFoundException(String resource, String name) {
		super(String.format("%s '%s' not found", resource, name));
	}
}
