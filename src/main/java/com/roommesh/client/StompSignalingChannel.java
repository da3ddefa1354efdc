package com.roommesh.client;

import com.roommesh.dto.JoinRoomRequest;
import com.roommesh.dto.LocationMessage;
import com.roommesh.dto.ParticipantEvent;
import com.roommesh.dto.RoomStateMessage;
import com.roommesh.dto.SignalEnvelope;
import com.roommesh.dto.SignalingEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.converter.MappingJackson2MessageConverter;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.messaging.WebSocketStompClient;

import java.lang.reflect.Type;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * {@link SignalingChannel} over STOMP/WebSocket. The relay reports the assigned participant id
 * in the {@code user-name} header of the CONNECTED frame.
 */
public class StompSignalingChannel implements SignalingChannel {
    private static final Logger log = LoggerFactory.getLogger(StompSignalingChannel.class);
    private static final String PARTICIPANT_ID_HEADER = "user-name";

    private final WebSocketStompClient stompClient;
    private final String url;
    private volatile StompSession session;

    public StompSignalingChannel(String url) {
        this(defaultStompClient(), url);
    }

    public StompSignalingChannel(WebSocketStompClient stompClient, String url) {
        this.stompClient = stompClient;
        this.url = url;
    }

    public static WebSocketStompClient defaultStompClient() {
        WebSocketStompClient client = new WebSocketStompClient(new StandardWebSocketClient());
        client.setMessageConverter(new MappingJackson2MessageConverter());
        client.setDefaultHeartbeat(new long[] {0, 0});
        return client;
    }

    @Override
    public CompletableFuture<String> connect(Listener listener) {
        CompletableFuture<String> connected = new CompletableFuture<>();
        log.info("Connecting to relay at {}", url);
        stompClient.connect(url, new RelaySessionHandler(listener, connected))
                .addCallback(s -> { }, connected::completeExceptionally);
        return connected;
    }

    @Override
    public void joinRoom(String roomId) {
        send(SignalingEvents.JOIN_ROOM, new JoinRoomRequest(roomId));
    }

    @Override
    public void leaveRoom() {
        send(SignalingEvents.LEAVE_ROOM, Collections.emptyMap());
    }

    @Override
    public void sendSignal(SignalEnvelope envelope) {
        send(SignalingEvents.WEBRTC_SIGNAL, envelope);
    }

    @Override
    public void sendLocation(LocationMessage location) {
        send(SignalingEvents.LOCATION_UPDATE, location);
    }

    @Override
    public void disconnect() {
        StompSession current = session;
        session = null;
        if (current != null && current.isConnected()) {
            current.disconnect();
            log.info("Disconnected from relay");
        }
    }

    // The WebSocket session does not allow concurrent writes.
    private synchronized void send(String event, Object payload) {
        StompSession current = session;
        if (current == null || !current.isConnected()) {
            throw new IllegalStateException("Not connected to relay, cannot send " + event);
        }
        current.send(SignalingEvents.APP_PREFIX + "/" + event, payload);
    }

    private final class RelaySessionHandler extends StompSessionHandlerAdapter {
        private final Listener listener;
        private final CompletableFuture<String> connected;

        private RelaySessionHandler(Listener listener, CompletableFuture<String> connected) {
            this.listener = listener;
            this.connected = connected;
        }

        @Override
        public void afterConnected(StompSession stompSession, StompHeaders connectedHeaders) {
            String participantId = connectedHeaders.getFirst(PARTICIPANT_ID_HEADER);
            if (participantId == null) {
                connected.completeExceptionally(new IllegalStateException("Relay did not assign a participant id"));
                stompSession.disconnect();
                return;
            }
            subscribe(stompSession, SignalingEvents.ROOM_STATE, RoomStateMessage.class, listener::onRoomState);
            subscribe(stompSession, SignalingEvents.USER_JOINED, ParticipantEvent.class, listener::onUserJoined);
            subscribe(stompSession, SignalingEvents.USER_LEFT, ParticipantEvent.class, listener::onUserLeft);
            subscribe(stompSession, SignalingEvents.WEBRTC_SIGNAL, SignalEnvelope.class, listener::onSignal);
            subscribe(stompSession, SignalingEvents.LOCATION_UPDATE, LocationMessage.class, listener::onLocationUpdate);
            session = stompSession;
            log.info("Connected to relay as {}", participantId);
            connected.complete(participantId);
        }

        @Override
        public void handleException(StompSession stompSession, StompCommand command, StompHeaders headers,
                                    byte[] payload, Throwable exception) {
            log.error("Error handling {} frame from relay: {}", command, exception.getMessage(), exception);
        }

        @Override
        public void handleTransportError(StompSession stompSession, Throwable exception) {
            if (!connected.isDone()) {
                connected.completeExceptionally(exception);
                return;
            }
            log.warn("Relay connection lost: {}", exception.getMessage());
            session = null;
            listener.onDisconnected();
        }

        private <T> void subscribe(StompSession stompSession, String event, Class<T> payloadType, Consumer<T> consumer) {
            stompSession.subscribe("/user" + SignalingEvents.userQueue(event), new StompFrameHandler() {
                @Override
                public Type getPayloadType(StompHeaders headers) {
                    return payloadType;
                }

                @Override
                public void handleFrame(StompHeaders headers, Object payload) {
                    consumer.accept(payloadType.cast(payload));
                }
            });
        }
    }
}
