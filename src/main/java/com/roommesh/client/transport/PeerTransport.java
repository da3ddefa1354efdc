package com.roommesh.client.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Media channel to one remote participant. Negotiation, encryption and codecs are the
 * implementation's business; callers only exchange descriptions and candidates.
 */
public interface PeerTransport {

    void attachLocalTracks(MediaStream stream);

    CompletableFuture<SessionDescription> createOffer();

    CompletableFuture<SessionDescription> createAnswer();

    CompletableFuture<Void> setLocalDescription(SessionDescription description);

    CompletableFuture<Void> setRemoteDescription(SessionDescription description);

    CompletableFuture<Void> addIceCandidate(IceCandidate candidate);

    void restartIce();

    void close();

    /**
     * Callbacks may arrive on any thread.
     */
    interface Observer {

        void onIceCandidate(IceCandidate candidate);

        void onTrack(MediaStream stream);

        void onConnectionStateChange(TransportState state);
    }
}
