package com.odin.call_signaling_service.service.impl;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.MDC;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.service.CallEventLoop;
import com.odin.call_signaling_service.utility.Subscription;

import lombok.extern.slf4j.Slf4j;

/**
 * Event loop on a dedicated single thread, one per connected participant.
 */
@Slf4j
public class ExecutorCallEventLoop implements CallEventLoop {

	private final String participantId;
	private final ScheduledExecutorService executor;

	public ExecutorCallEventLoop(String participantId) {
		this.participantId = participantId;
		this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
			Thread thread = new Thread(r, "call-agent-" + participantId);
			thread.setDaemon(true);
			return thread;
		});
	}

	@Override
	public void execute(Runnable task) {
		try {
			executor.execute(wrap(task));
		} catch (RejectedExecutionException e) {
			log.debug("Event loop for {} is shut down, dropping task", participantId);
		}
	}

	@Override
	public Subscription schedule(Runnable task, Duration delay) {
		try {
			ScheduledFuture<?> future = executor.schedule(wrap(task), delay.toMillis(), TimeUnit.MILLISECONDS);
			return () -> future.cancel(false);
		} catch (RejectedExecutionException e) {
			log.debug("Event loop for {} is shut down, not scheduling", participantId);
			return Subscription.noop();
		}
	}

	@Override
	public void shutdown() {
		executor.shutdown();
		log.info("Event loop for {} shut down", participantId);
	}

	private Runnable wrap(Runnable task) {
		return () -> {
			MDC.put(ApplicationConstants.MDC_USER_ID, participantId);
			try {
				task.run();
			} catch (RuntimeException e) {
				log.error("Unhandled error in call agent of {}: {}", participantId, e.getMessage(), e);
			} finally {
				MDC.remove(ApplicationConstants.MDC_USER_ID);
				MDC.remove(ApplicationConstants.MDC_CALL_ID);
			}
		};
	}
}
