package com.odin.call_signaling_service.media.webrtc;

import java.util.List;

import com.odin.call_signaling_service.media.LocalMediaStream;
import com.odin.call_signaling_service.media.MediaTrack;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
class WebRtcLocalMediaStream implements LocalMediaStream {

	private final String id;
	private final List<MediaTrack> tracks;
}
