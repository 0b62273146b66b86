package com.odin.call_signaling_service.media.webrtc;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import com.odin.call_signaling_service.exception.MediaAccessDeniedException;
import com.odin.call_signaling_service.media.LocalMediaStream;
import com.odin.call_signaling_service.media.MediaConstraints;
import com.odin.call_signaling_service.media.MediaDevices;
import com.odin.call_signaling_service.media.MediaTrack;

import dev.onvoid.webrtc.PeerConnectionFactory;
import dev.onvoid.webrtc.media.audio.AudioDevice;
import dev.onvoid.webrtc.media.audio.AudioOptions;
import dev.onvoid.webrtc.media.audio.AudioTrack;
import dev.onvoid.webrtc.media.audio.AudioTrackSource;
import dev.onvoid.webrtc.media.video.VideoDevice;
import dev.onvoid.webrtc.media.video.VideoDeviceSource;
import dev.onvoid.webrtc.media.video.VideoTrack;
import lombok.extern.slf4j.Slf4j;

/**
 * Opens the first microphone and camera the native engine reports. Device probing runs on
 * the supplied executor since camera start-up blocks.
 */
@Slf4j
public class WebRtcMediaDevices implements MediaDevices {

	private final WebRtcEngine engine;
	private final Executor executor;

	public WebRtcMediaDevices(WebRtcEngine engine, Executor executor) {
		this.engine = engine;
		this.executor = executor;
	}

	@Override
	public CompletableFuture<LocalMediaStream> getUserMedia(MediaConstraints constraints) {
		return CompletableFuture.supplyAsync(() -> open(constraints), executor);
	}

	private LocalMediaStream open(MediaConstraints constraints) {
		PeerConnectionFactory factory = engine.getFactory();
		List<MediaTrack> tracks = new ArrayList<>();
		try {
			if (constraints.isAudio()) {
				List<AudioDevice> microphones = dev.onvoid.webrtc.media.MediaDevices.getAudioCaptureDevices();
				if (microphones.isEmpty()) {
					throw new MediaAccessDeniedException(null, "No microphone available");
				}
				AudioOptions options = new AudioOptions();
				options.echoCancellation = true;
				options.autoGainControl = true;
				options.noiseSuppression = true;
				AudioTrackSource source = factory.createAudioSource(options);
				AudioTrack track = factory.createAudioTrack("audio-" + UUID.randomUUID(), source);
				tracks.add(new WebRtcMediaTrack(track, null, true));
			}
			if (constraints.isVideo()) {
				List<VideoDevice> cameras = dev.onvoid.webrtc.media.MediaDevices.getVideoCaptureDevices();
				if (cameras.isEmpty()) {
					throw new MediaAccessDeniedException(null, "No camera available");
				}
				VideoDeviceSource source = new VideoDeviceSource();
				source.setVideoCaptureDevice(cameras.get(0));
				source.start();
				VideoTrack track = factory.createVideoTrack("video-" + UUID.randomUUID(), source);
				tracks.add(new WebRtcMediaTrack(track, source, true));
			}
		} catch (MediaAccessDeniedException e) {
			tracks.forEach(MediaTrack::stop);
			log.warn("Media access denied: {}", e.getMessage());
			throw e;
		} catch (RuntimeException e) {
			tracks.forEach(MediaTrack::stop);
			log.error("Failed to open capture devices: {}", e.getMessage(), e);
			throw new MediaAccessDeniedException(null, "Capture device could not be opened", e);
		}
		log.info("Opened local media: {} track(s)", tracks.size());
		return new WebRtcLocalMediaStream("stream-" + UUID.randomUUID(), tracks);
	}
}
