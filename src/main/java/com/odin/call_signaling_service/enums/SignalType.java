package com.odin.call_signaling_service.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SignalType {
	OFFER("call-offer"),
	ANSWER("call-answer"),
	ICE_CANDIDATE("ice-candidate");

	private final String event;

	SignalType(String event) {
		this.event = event;
	}

	@JsonValue
	public String getEvent() {
		return event;
	}

	@JsonCreator
	public static SignalType fromEvent(String event) {
		for (SignalType type : values()) {
			if (type.event.equals(event) || type.name().equals(event)) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown signal event: " + event);
	}
}
