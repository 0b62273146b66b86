package com.odin.call_signaling_service.media;

import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.enums.PeerConnectionState;

/**
 * Callbacks raised by a peer connection, possibly on a native thread.
 */
public interface PeerConnectionListener {

	void onIceCandidate(IceCandidatePayload candidate);

	void onConnectionStateChange(PeerConnectionState state);

	void onRemoteTrack(MediaTrack track);
}
