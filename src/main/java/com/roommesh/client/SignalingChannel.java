package com.roommesh.client;

import com.roommesh.dto.LocationMessage;
import com.roommesh.dto.ParticipantEvent;
import com.roommesh.dto.RoomStateMessage;
import com.roommesh.dto.SignalEnvelope;

import java.util.concurrent.CompletableFuture;

/**
 * Client end of the relay connection.
 */
public interface SignalingChannel {

    /**
     * Opens the connection. The future completes with the participant id the relay assigned.
     */
    CompletableFuture<String> connect(Listener listener);

    void joinRoom(String roomId);

    void leaveRoom();

    void sendSignal(SignalEnvelope envelope);

    void sendLocation(LocationMessage location);

    void disconnect();

    /**
     * Relay events, delivered one at a time in the order the relay sent them.
     */
    interface Listener {

        void onRoomState(RoomStateMessage roomState);

        void onUserJoined(ParticipantEvent event);

        void onUserLeft(ParticipantEvent event);

        void onSignal(SignalEnvelope envelope);

        void onLocationUpdate(LocationMessage location);

        void onDisconnected();
    }
}
