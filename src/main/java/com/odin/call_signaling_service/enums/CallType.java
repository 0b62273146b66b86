package com.odin.call_signaling_service.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Media kind of a call, fixed for the lifetime of the session.
 */
public enum CallType {
	VIDEO("video"),
	AUDIO("audio");

	private final String value;

	CallType(String value) {
		this.value = value;
	}

	@JsonValue
	public String getValue() {
		return value;
	}

	public boolean wantsVideo() {
		return this == VIDEO;
	}

	/**
	 * Accepts "video"/"audio" in any case. Blank input defaults to video, like the
	 * column default of the call table.
	 */
	@JsonCreator
	public static CallType fromString(String raw) {
		if (raw == null || raw.isBlank()) {
			return VIDEO;
		}
		for (CallType type : values()) {
			if (type.value.equalsIgnoreCase(raw.trim()) || type.name().equalsIgnoreCase(raw.trim())) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown call type: " + raw);
	}
}
