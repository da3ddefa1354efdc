package com.roommesh.client;

import com.roommesh.dto.LocationMessage;
import com.roommesh.dto.ParticipantEvent;
import com.roommesh.dto.RoomStateMessage;
import com.roommesh.dto.SignalEnvelope;
import com.roommesh.dto.SignalingEvents;
import com.roommesh.repository.RoomRegistry;
import com.roommesh.service.ParticipantMessenger;
import com.roommesh.service.RelayCoordinator;
import com.roommesh.service.SignalingException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a real {@link RelayCoordinator} in-process. Requests from clients are handled immediately;
 * events to clients are queued and delivered one at a time by {@link #drain()}, in the order the
 * coordinator sent them.
 */
class InMemoryRelay implements ParticipantMessenger {
    final RoomRegistry registry = new RoomRegistry();
    final RelayCoordinator coordinator = new RelayCoordinator(registry, this);
    final List<SignalEnvelope> deliveredSignals = new ArrayList<>();
    final List<String> deliveredSignalTargets = new ArrayList<>();
    final List<SignalingException> dropped = new ArrayList<>();

    private final Deque<Runnable> deliveries = new ArrayDeque<>();
    private final Map<String, SignalingChannel.Listener> listeners = new HashMap<>();

    SignalingChannel channel(String participantId) {
        return new Channel(participantId);
    }

    @Override
    public void send(String participantId, String event, Object payload) {
        SignalingChannel.Listener listener = listeners.get(participantId);
        if (listener == null) {
            return;
        }
        deliveries.addLast(() -> dispatch(participantId, listener, event, payload));
    }

    void drain() {
        Runnable delivery;
        while ((delivery = deliveries.pollFirst()) != null) {
            delivery.run();
        }
    }

    long deliveredSignalsOfType(String type) {
        return deliveredSignals.stream().filter(e -> type.equals(e.getSignal().get("type"))).count();
    }

    private void dispatch(String participantId, SignalingChannel.Listener listener, String event, Object payload) {
        if (!listeners.containsKey(participantId)) {
            return;
        }
        switch (event) {
            case SignalingEvents.ROOM_STATE:
                listener.onRoomState((RoomStateMessage) payload);
                break;
            case SignalingEvents.USER_JOINED:
                listener.onUserJoined((ParticipantEvent) payload);
                break;
            case SignalingEvents.USER_LEFT:
                listener.onUserLeft((ParticipantEvent) payload);
                break;
            case SignalingEvents.WEBRTC_SIGNAL:
                deliveredSignals.add((SignalEnvelope) payload);
                deliveredSignalTargets.add(participantId);
                listener.onSignal((SignalEnvelope) payload);
                break;
            case SignalingEvents.LOCATION_UPDATE:
                listener.onLocationUpdate((LocationMessage) payload);
                break;
            default:
                throw new IllegalArgumentException("Unexpected event " + event);
        }
    }

    private void guarded(Runnable request) {
        try {
            request.run();
        } catch (SignalingException e) {
            dropped.add(e);
        }
    }

    private final class Channel implements SignalingChannel {
        private final String participantId;

        private Channel(String participantId) {
            this.participantId = participantId;
        }

        @Override
        public CompletableFuture<String> connect(Listener listener) {
            listeners.put(participantId, listener);
            coordinator.connect(participantId);
            return CompletableFuture.completedFuture(participantId);
        }

        @Override
        public void joinRoom(String roomId) {
            guarded(() -> coordinator.join(participantId, roomId));
        }

        @Override
        public void leaveRoom() {
            guarded(() -> coordinator.leave(participantId));
        }

        @Override
        public void sendSignal(SignalEnvelope envelope) {
            guarded(() -> coordinator.relay(participantId, envelope));
        }

        @Override
        public void sendLocation(LocationMessage location) {
            guarded(() -> coordinator.locationUpdate(participantId, location));
        }

        @Override
        public void disconnect() {
            listeners.remove(participantId);
            coordinator.disconnect(participantId);
        }
    }
}
