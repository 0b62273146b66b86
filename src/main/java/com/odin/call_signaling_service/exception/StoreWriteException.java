package com.odin.call_signaling_service.exception;

/**
 * The session store could not be reached while writing. Retryable.
 */
public class StoreWriteException extends CallSignalingException {

	private static final long serialVersionUID = 1L;

	public StoreWriteException(String callId, String message) {
		super(callId, message);
	}

	public StoreWriteException(String callId, String message, Throwable cause) {
		super(callId, message, cause);
	}
}
