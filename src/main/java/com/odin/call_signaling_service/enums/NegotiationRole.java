package com.odin.call_signaling_service.enums;

public enum NegotiationRole {
	OFFERER,
	ANSWERER
}
