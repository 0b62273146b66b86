package com.odin.call_signaling_service.enums;

import java.util.EnumSet;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a call session.
 *
 * PENDING -> ACCEPTED | REJECTED | ENDED | MISSED
 * ACCEPTED -> ENDED
 * REJECTED, ENDED and MISSED are terminal.
 */
public enum CallStatus {
	PENDING("pending"),
	ACCEPTED("accepted"),
	REJECTED("rejected"),
	ENDED("ended"),
	MISSED("missed");

	private final String value;

	CallStatus(String value) {
		this.value = value;
	}

	@JsonValue
	public String getValue() {
		return value;
	}

	public boolean isTerminal() {
		return this == REJECTED || this == ENDED || this == MISSED;
	}

	public boolean canTransitionTo(CallStatus next) {
		return allowedNext().contains(next);
	}

	public Set<CallStatus> allowedNext() {
		switch (this) {
		case PENDING:
			return EnumSet.of(ACCEPTED, REJECTED, ENDED, MISSED);
		case ACCEPTED:
			return EnumSet.of(ENDED);
		default:
			return EnumSet.noneOf(CallStatus.class);
		}
	}

	@JsonCreator
	public static CallStatus fromString(String raw) {
		for (CallStatus status : values()) {
			if (status.value.equalsIgnoreCase(raw) || status.name().equalsIgnoreCase(raw)) {
				return status;
			}
		}
		throw new IllegalArgumentException("Unknown call status: " + raw);
	}
}
