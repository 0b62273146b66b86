package com.odin.call_signaling_service.utility;

/**
 * Handle returned by every subscribe call. Cancelling twice is a no-op.
 */
@FunctionalInterface
public interface Subscription {

	void cancel();

	static Subscription noop() {
		return () -> {
		};
	}
}
