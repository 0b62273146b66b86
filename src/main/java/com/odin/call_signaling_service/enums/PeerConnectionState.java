package com.odin.call_signaling_service.enums;

public enum PeerConnectionState {
	NEW,
	CONNECTING,
	CONNECTED,
	DISCONNECTED,
	FAILED,
	CLOSED;

	public boolean isBroken() {
		return this == DISCONNECTED || this == FAILED;
	}
}
