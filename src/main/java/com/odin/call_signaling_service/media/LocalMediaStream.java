package com.odin.call_signaling_service.media;

import java.util.List;
import java.util.stream.Collectors;

import com.odin.call_signaling_service.enums.MediaKind;

public interface LocalMediaStream {

	String getId();

	List<MediaTrack> getTracks();

	default List<MediaTrack> getAudioTracks() {
		return getTracks().stream().filter(t -> t.getKind() == MediaKind.AUDIO).collect(Collectors.toList());
	}

	default List<MediaTrack> getVideoTracks() {
		return getTracks().stream().filter(t -> t.getKind() == MediaKind.VIDEO).collect(Collectors.toList());
	}

	default void stop() {
		getTracks().forEach(MediaTrack::stop);
	}
}
