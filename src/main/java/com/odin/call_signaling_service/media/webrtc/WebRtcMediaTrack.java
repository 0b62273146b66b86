package com.odin.call_signaling_service.media.webrtc;

import com.odin.call_signaling_service.enums.MediaKind;
import com.odin.call_signaling_service.media.MediaTrack;

import dev.onvoid.webrtc.media.MediaStreamTrack;
import dev.onvoid.webrtc.media.video.VideoDeviceSource;
import lombok.extern.slf4j.Slf4j;

@Slf4j
class WebRtcMediaTrack implements MediaTrack {

	private final MediaStreamTrack track;
	private final VideoDeviceSource videoSource;
	private final boolean local;
	private boolean stopped;

	WebRtcMediaTrack(MediaStreamTrack track, VideoDeviceSource videoSource, boolean local) {
		this.track = track;
		this.videoSource = videoSource;
		this.local = local;
	}

	static WebRtcMediaTrack remote(MediaStreamTrack track) {
		return new WebRtcMediaTrack(track, null, false);
	}

	MediaStreamTrack unwrap() {
		return track;
	}

	@Override
	public String getId() {
		return track.getId();
	}

	@Override
	public MediaKind getKind() {
		return "video".equals(track.getKind()) ? MediaKind.VIDEO : MediaKind.AUDIO;
	}

	@Override
	public boolean isEnabled() {
		return track.isEnabled();
	}

	@Override
	public void setEnabled(boolean enabled) {
		track.setEnabled(enabled);
	}

	@Override
	public synchronized void stop() {
		if (stopped || !local) {
			return;
		}
		stopped = true;
		try {
			track.setEnabled(false);
			track.dispose();
			if (videoSource != null) {
				videoSource.stop();
				videoSource.dispose();
			}
		} catch (RuntimeException e) {
			log.warn("Failed to release {} track {}: {}", getKind(), getId(), e.getMessage());
		}
	}
}
