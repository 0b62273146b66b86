package com.odin.call_signaling_service.service;

import java.time.Duration;

import com.odin.call_signaling_service.utility.Subscription;

/**
 * Single ordered inbox of a call agent. Tasks never run concurrently with each other, so
 * the agent's state needs no locking as long as it is only touched from here.
 */
public interface CallEventLoop {

	void execute(Runnable task);

	/**
	 * Runs {@code task} on the loop after {@code delay}. Cancelling the returned handle
	 * before it fires drops the task.
	 */
	Subscription schedule(Runnable task, Duration delay);

	void shutdown();
}
