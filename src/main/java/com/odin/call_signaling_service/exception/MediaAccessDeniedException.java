package com.odin.call_signaling_service.exception;

/**
 * Local capture device missing or permission refused. Aborts the call attempt on the
 * side that asked for media; never retried automatically.
 */
public class MediaAccessDeniedException extends CallSignalingException {

	private static final long serialVersionUID = 1L;

	public MediaAccessDeniedException(String callId, String message) {
		super(callId, message);
	}

	public MediaAccessDeniedException(String callId, String message, Throwable cause) {
		super(callId, message, cause);
	}
}
