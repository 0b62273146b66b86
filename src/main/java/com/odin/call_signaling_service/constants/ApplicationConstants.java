package com.odin.call_signaling_service.constants;

public class ApplicationConstants {

	public static final String API_VERSION = "/v1";
	public static final String CALL = "/call";
	public static final String START = "/start";
	public static final String ACCEPT = "/accept";
	public static final String REJECT = "/reject";
	public static final String END = "/end";
	public static final String TOGGLE_VIDEO = "/toggle-video";
	public static final String TOGGLE_AUDIO = "/toggle-audio";
	public static final String VIEW = "/view";
	public static final String HISTORY = "/history";
	public static final String USER_STATUS = "/user-status/{userId}";

	public static final String BEARER_PREFIX = "Bearer ";

	// Redis keys and channels
	public static final String CALL_SESSION_KEY_PREFIX = "call:session:";
	public static final String CALL_SESSION_EVENTS_CHANNEL = "call:session:events";
	public static final String CALL_SIGNAL_CHANNEL_PREFIX = "call:";
	public static final String CONNECTION_KEY_PREFIX = "websocket:connection:";

	// Kafka
	public static final String KAFKA_MISSED_CALL_TOPIC = "call.missed.notification";
	public static final long MISSED_CALL_NOTIFICATION_ID = 3001L;

	// MDC keys
	public static final String MDC_USER_ID = "userId";
	public static final String MDC_CALL_ID = "callId";

	// Notification map keys
	public static final String NOTIFICATION_MAP_CALL_ID = "callId";
	public static final String NOTIFICATION_MAP_CALLER_ID = "callerId";
	public static final String NOTIFICATION_MAP_CALL_TYPE = "callType";
	public static final String NOTIFICATION_MAP_MISSED_AT = "missedAt";

	private ApplicationConstants() {
	}
}
