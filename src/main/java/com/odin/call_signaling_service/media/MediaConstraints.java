package com.odin.call_signaling_service.media;

import lombok.Value;

@Value
public class MediaConstraints {
	boolean video;
	boolean audio;
}
