package com.odin.call_signaling_service.media;

import com.odin.call_signaling_service.enums.MediaKind;

public interface MediaTrack {

	String getId();

	MediaKind getKind();

	boolean isEnabled();

	/**
	 * Mutes or unmutes the track in place; the peer connection is not renegotiated.
	 */
	void setEnabled(boolean enabled);

	/**
	 * Releases the underlying capture device. Safe to call more than once.
	 */
	void stop();
}
