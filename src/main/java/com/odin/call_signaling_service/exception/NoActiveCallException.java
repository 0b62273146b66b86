package com.odin.call_signaling_service.exception;

public class NoActiveCallException extends CallSignalingException {

	private static final long serialVersionUID = 1L;

	public NoActiveCallException(String callId, String message) {
		super(callId, message);
	}

	public NoActiveCallException(String callId, String message, Throwable cause) {
		super(callId, message, cause);
	}
}
