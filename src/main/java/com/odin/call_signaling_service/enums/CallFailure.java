package com.odin.call_signaling_service.enums;

/**
 * What the participant is told when a call attempt did not go through. Only a
 * permission problem is distinguished; everything else reads as "call ended".
 */
public enum CallFailure {
	NONE,
	CALL_ENDED,
	MEDIA_ACCESS_DENIED,
	SIGNALING_UNAVAILABLE
}
