package com.odin.call_signaling_service.enums;

public enum NotificationChannel {
	SMS,
	EMAIL,
	INAPP
}
