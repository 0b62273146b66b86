package com.odin.call_signaling_service.support;

import java.util.ArrayList;
import java.util.List;

import com.odin.call_signaling_service.enums.MediaKind;
import com.odin.call_signaling_service.media.LocalMediaStream;
import com.odin.call_signaling_service.media.MediaTrack;

public class FakeLocalMediaStream implements LocalMediaStream {

	private final String id;
	private final List<MediaTrack> tracks = new ArrayList<>();

	public FakeLocalMediaStream(String id, boolean video, boolean audio) {
		this.id = id;
		if (audio) {
			tracks.add(new FakeMediaTrack(id + "-audio", MediaKind.AUDIO));
		}
		if (video) {
			tracks.add(new FakeMediaTrack(id + "-video", MediaKind.VIDEO));
		}
	}

	@Override
	public String getId() {
		return id;
	}

	@Override
	public List<MediaTrack> getTracks() {
		return tracks;
	}

	public boolean isStopped() {
		return !tracks.isEmpty() && tracks.stream().allMatch(t -> ((FakeMediaTrack) t).isStopped());
	}
}
