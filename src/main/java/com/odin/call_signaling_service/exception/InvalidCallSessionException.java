package com.odin.call_signaling_service.exception;

public class InvalidCallSessionException extends CallSignalingException {

	private static final long serialVersionUID = 1L;

	public InvalidCallSessionException(String callId, String message) {
		super(callId, message);
	}

	public InvalidCallSessionException(String callId, String message, Throwable cause) {
		super(callId, message, cause);
	}
}
