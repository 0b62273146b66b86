package com.odin.call_signaling_service.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import com.odin.call_signaling_service.dto.ResponseDTO;
import com.odin.call_signaling_service.exception.CallAlreadyActiveException;
import com.odin.call_signaling_service.exception.CallSignalingException;
import com.odin.call_signaling_service.exception.InvalidCallSessionException;
import com.odin.call_signaling_service.exception.InvalidCallTransitionException;
import com.odin.call_signaling_service.exception.MediaAccessDeniedException;
import com.odin.call_signaling_service.exception.NoActiveCallException;
import com.odin.call_signaling_service.exception.SignalingDeliveryException;
import com.odin.call_signaling_service.exception.StaleCallSessionException;
import com.odin.call_signaling_service.exception.StoreWriteException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps call failures to HTTP responses. Only a media permission problem gets its own
 * status text; the client shows every other failure as "call ended".
 */
@Slf4j
@RestControllerAdvice
public class CallExceptionHandler {

	@ExceptionHandler(MediaAccessDeniedException.class)
	public ResponseEntity<ResponseDTO> mediaAccessDenied(MediaAccessDeniedException e) {
		log.warn("Media access denied for call {}: {}", e.getCallId(), e.getMessage());
		return respond(HttpStatus.FORBIDDEN, "MEDIA_ACCESS_DENIED", e.getMessage());
	}

	@ExceptionHandler(InvalidCallSessionException.class)
	public ResponseEntity<ResponseDTO> invalidSession(InvalidCallSessionException e) {
		return respond(HttpStatus.BAD_REQUEST, "INVALID_CALL", e.getMessage());
	}

	@ExceptionHandler({ CallAlreadyActiveException.class, InvalidCallTransitionException.class,
			StaleCallSessionException.class })
	public ResponseEntity<ResponseDTO> conflict(CallSignalingException e) {
		log.info("Call command conflict (call {}): {}", e.getCallId(), e.getMessage());
		return respond(HttpStatus.CONFLICT, "CALL_ENDED", e.getMessage());
	}

	@ExceptionHandler(NoActiveCallException.class)
	public ResponseEntity<ResponseDTO> noActiveCall(NoActiveCallException e) {
		return respond(HttpStatus.NOT_FOUND, "NO_ACTIVE_CALL", e.getMessage());
	}

	@ExceptionHandler({ StoreWriteException.class, SignalingDeliveryException.class })
	public ResponseEntity<ResponseDTO> unavailable(CallSignalingException e) {
		log.error("Call {} failed on a backing service: {}", e.getCallId(), e.getMessage(), e);
		return respond(HttpStatus.SERVICE_UNAVAILABLE, "CALL_ENDED", e.getMessage());
	}

	@ExceptionHandler(CallSignalingException.class)
	public ResponseEntity<ResponseDTO> callFailure(CallSignalingException e) {
		log.error("Call {} failed: {}", e.getCallId(), e.getMessage(), e);
		return respond(HttpStatus.INTERNAL_SERVER_ERROR, "CALL_ENDED", e.getMessage());
	}

	@ExceptionHandler(ResponseStatusException.class)
	public ResponseEntity<ResponseDTO> responseStatus(ResponseStatusException e) {
		HttpStatus status = HttpStatus.valueOf(e.getStatusCode().value());
		return respond(status, status.name(), e.getReason());
	}

	private ResponseEntity<ResponseDTO> respond(HttpStatus status, String code, String message) {
		return ResponseEntity.status(status).body(ResponseDTO.error(status.value(), code, message));
	}
}
