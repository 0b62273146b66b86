package com.odin.call_signaling_service.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Change notification published by the session store after every successful write.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class CallSessionEvent {

	public enum Type {
		INSERT,
		UPDATE
	}

	private Type type;
	private CallSession session;

	public static CallSessionEvent insert(CallSession session) {
		return new CallSessionEvent(Type.INSERT, session);
	}

	public static CallSessionEvent update(CallSession session) {
		return new CallSessionEvent(Type.UPDATE, session);
	}
}
