package com.odin.call_signaling_service.media;

import java.util.concurrent.CompletableFuture;

/**
 * Access to local capture devices.
 */
public interface MediaDevices {

	/**
	 * Opens the requested capture devices. The future fails with
	 * {@link com.odin.call_signaling_service.exception.MediaAccessDeniedException} when a
	 * device is missing or access is refused.
	 */
	CompletableFuture<LocalMediaStream> getUserMedia(MediaConstraints constraints);
}
