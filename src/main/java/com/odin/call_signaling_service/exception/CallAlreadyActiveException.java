package com.odin.call_signaling_service.exception;

public class CallAlreadyActiveException extends CallSignalingException {

	private static final long serialVersionUID = 1L;

	public CallAlreadyActiveException(String callId, String message) {
		super(callId, message);
	}

	public CallAlreadyActiveException(String callId, String message, Throwable cause) {
		super(callId, message, cause);
	}
}
