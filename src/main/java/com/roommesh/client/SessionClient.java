package com.roommesh.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roommesh.client.transport.LocalMediaSource;
import com.roommesh.client.transport.MediaAcquisitionException;
import com.roommesh.client.transport.MediaStream;
import com.roommesh.client.transport.PeerTransportFactory;
import com.roommesh.client.transport.PresenceDisplay;
import com.roommesh.client.transport.TransportState;
import com.roommesh.dto.LocationMessage;
import com.roommesh.dto.ParticipantEvent;
import com.roommesh.dto.RoomStateMessage;
import com.roommesh.dto.SignalEnvelope;
import com.roommesh.model.LatLng;
import com.roommesh.model.ParticipantLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * One participant's side of the mesh: follows room membership as reported by the relay and keeps
 * one {@link PeerLink} per other member once local media is available.
 * <p>
 * This client offers to every member it sees while it has media: the members listed in its
 * {@code room-state}, every later {@code user-joined}, and all known members when local media
 * becomes ready. Members seen before media is ready stay pending until then, and signals they
 * send in the meantime are queued and replayed, in order, on the link created for them.
 * <p>
 * Relay events, media readiness and location updates may arrive on different threads; the link
 * map and membership view are only changed under the session lock, and links are closed
 * synchronously before the handler that removed them returns.
 */
public class SessionClient implements SignalingChannel.Listener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SessionClient.class);
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<Map<String, Object>>() { };

    /** Marker key of the local participant on the location display. */
    public static final String SELF_MARKER = "self";

    private final SignalingChannel channel;
    private final PeerTransportFactory transportFactory;
    private final LocalMediaSource mediaSource;
    private final PresenceDisplay<MediaStream> videoDisplay;
    private final PresenceDisplay<LatLng> locationDisplay;
    private final SessionListener sessionListener;
    private final PeerLinkOptions linkOptions;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final ObjectMapper objectMapper;
    private final PeerLink.Listener linkListener = new LinkListener();

    private final Object lock = new Object();
    private final Map<String, PeerLink> peers = new ConcurrentHashMap<>();
    private final Set<String> members = new LinkedHashSet<>();
    private final Set<String> pendingPeers = new LinkedHashSet<>();
    private final Map<String, List<Signal>> pendingSignals = new LinkedHashMap<>();
    private volatile String localId;
    private volatile String roomId;
    private volatile MediaStream localStream;

    private SessionClient(Builder builder) {
        this.channel = Objects.requireNonNull(builder.channel, "channel");
        this.transportFactory = Objects.requireNonNull(builder.transportFactory, "transportFactory");
        this.mediaSource = Objects.requireNonNull(builder.mediaSource, "mediaSource");
        this.videoDisplay = builder.videoDisplay;
        this.locationDisplay = builder.locationDisplay;
        this.sessionListener = builder.sessionListener;
        this.linkOptions = builder.linkOptions;
        this.objectMapper = builder.objectMapper;
        if (builder.scheduler != null) {
            this.scheduler = builder.scheduler;
            this.ownsScheduler = false;
        } else {
            CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("peer-link-timeout-");
            threadFactory.setDaemon(true);
            this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory);
            this.ownsScheduler = true;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Connects to the relay; completes with the participant id assigned to this client.
     */
    public CompletableFuture<String> connect() {
        return channel.connect(this).thenApply(id -> {
            localId = id;
            log.info("Signaling connected: {}", id);
            return id;
        });
    }

    /**
     * Joins {@code roomName}, trimmed. Links of a previous room are torn down first.
     */
    public void joinRoom(String roomName) {
        String trimmed = roomName != null ? roomName.trim() : "";
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Room name must not be blank");
        }
        requireConnected();
        synchronized (lock) {
            if (roomId != null) {
                log.info("Leaving room {} to join {}", roomId, trimmed);
                resetRoom();
            }
            roomId = trimmed;
        }
        try {
            channel.joinRoom(trimmed);
        } catch (RuntimeException e) {
            synchronized (lock) {
                if (trimmed.equals(roomId)) {
                    roomId = null;
                }
            }
            throw e;
        }
        log.info("Joining room: {}", trimmed);
    }

    public void leaveRoom() {
        synchronized (lock) {
            if (roomId == null) {
                return;
            }
            log.info("Leaving room {}", roomId);
            resetRoom();
            roomId = null;
        }
        channel.leaveRoom();
    }

    /**
     * Acquires camera and microphone. On success every known member gets an offer; on failure the
     * future completes with a {@link MediaAcquisitionException} and the session stays usable.
     */
    public CompletableFuture<MediaStream> startLocalMedia() {
        CompletableFuture<MediaStream> result = new CompletableFuture<>();
        CompletableFuture<MediaStream> acquisition;
        try {
            acquisition = mediaSource.acquire();
        } catch (RuntimeException e) {
            acquisition = CompletableFuture.failedFuture(e);
        }
        acquisition.whenComplete((stream, ex) -> {
            if (ex == null && stream == null) {
                ex = new MediaAcquisitionException("Media source returned no stream");
            }
            if (ex != null) {
                MediaAcquisitionException failure = asMediaFailure(ex);
                log.error("Error accessing camera/microphone: {}", failure.getMessage());
                result.completeExceptionally(failure);
                return;
            }
            onLocalMediaReady(stream);
            result.complete(stream);
        });
        return result;
    }

    /**
     * Position from the geolocation watch. Shown locally and shared with the room, if any.
     */
    public void publishLocation(double lat, double lng) {
        locationDisplay.upsert(SELF_MARKER, new LatLng(lat, lng));
        String currentRoom = roomId;
        if (currentRoom == null || localId == null) {
            return;
        }
        channel.sendLocation(new LocationMessage(currentRoom, null, lat, lng));
    }

    @Override
    public void close() {
        synchronized (lock) {
            resetRoom();
            roomId = null;
        }
        channel.disconnect();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        log.info("Session {} closed", localId);
    }

    @Override
    public void onRoomState(RoomStateMessage roomState) {
        List<PeerLink> toOffer = new ArrayList<>();
        List<PeerLink> stale = new ArrayList<>();
        Set<String> view;
        synchronized (lock) {
            if (roomId == null) {
                log.debug("Ignoring room state outside of a room");
                return;
            }
            members.clear();
            for (String userId : roomState.getUsers()) {
                if (userId.equals(localId)) {
                    log.warn("Room state listed this client itself, ignoring that entry");
                    continue;
                }
                members.add(userId);
            }
            for (String peerId : new ArrayList<>(peers.keySet())) {
                if (!members.contains(peerId)) {
                    stale.add(peers.remove(peerId));
                }
            }
            pendingPeers.retainAll(members);
            pendingSignals.keySet().retainAll(members);
            if (localStream != null) {
                for (String userId : members) {
                    toOffer.add(ensureLink(userId));
                }
            } else {
                pendingPeers.addAll(members);
            }
            view = roomMembersLocked();
        }
        log.info("Room state received: {} other participants", view.size() - 1);
        stale.forEach(this::discard);
        sessionListener.onMembershipChanged(view);
        offerWhereNeeded(toOffer);

        for (ParticipantLocation location : roomState.getLocations()) {
            if (!location.getUserId().equals(localId)) {
                locationDisplay.upsert(location.getUserId(), new LatLng(location.getLat(), location.getLng()));
            }
        }
    }

    @Override
    public void onUserJoined(ParticipantEvent event) {
        String userId = event.getUserId();
        if (userId == null || userId.equals(localId)) {
            log.warn("Ignoring user-joined for {}", userId);
            return;
        }
        PeerLink link = null;
        Set<String> view;
        synchronized (lock) {
            if (roomId == null) {
                return;
            }
            members.add(userId);
            if (localStream != null) {
                link = ensureLink(userId);
            } else {
                pendingPeers.add(userId);
                log.info("User {} joined; offer deferred until local media is ready", userId);
            }
            view = roomMembersLocked();
        }
        log.info("User joined: {}", userId);
        sessionListener.onMembershipChanged(view);
        if (link != null) {
            offerWhereNeeded(Collections.singletonList(link));
        }
    }

    @Override
    public void onUserLeft(ParticipantEvent event) {
        String userId = event.getUserId();
        if (userId == null) {
            return;
        }
        PeerLink link;
        Set<String> view;
        synchronized (lock) {
            members.remove(userId);
            pendingPeers.remove(userId);
            pendingSignals.remove(userId);
            link = peers.remove(userId);
            view = roomMembersLocked();
        }
        log.info("User left: {}", userId);
        if (link != null) {
            discard(link);
        } else {
            videoDisplay.remove(userId);
        }
        locationDisplay.remove(userId);
        sessionListener.onMembershipChanged(view);
    }

    @Override
    public void onSignal(SignalEnvelope envelope) {
        String from = envelope.getFrom();
        if (from == null || from.equals(localId)) {
            log.warn("Ignoring signal with sender {}", from);
            return;
        }
        String currentRoom = roomId;
        if (currentRoom == null || !currentRoom.equals(envelope.getRoomId())) {
            log.debug("Ignoring signal from {} for room {} (current room {})", from, envelope.getRoomId(), currentRoom);
            return;
        }
        Signal signal;
        try {
            signal = objectMapper.convertValue(envelope.getSignal(), Signal.class);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed signal from {}: {}", from, e.getMessage());
            return;
        }
        if (signal == null) {
            log.warn("Empty signal from {}", from);
            return;
        }
        log.debug("Received WebRTC signal from {}: {}", from, signal.getType());

        PeerLink link;
        synchronized (lock) {
            if (!envelope.getRoomId().equals(roomId)) {
                log.debug("Ignoring signal from {}: room changed to {}", from, roomId);
                return;
            }
            members.add(from);
            link = peers.get(from);
            if (link == null) {
                if (localStream == null) {
                    pendingPeers.add(from);
                    pendingSignals.computeIfAbsent(from, k -> new ArrayList<>()).add(signal);
                    log.info("Queueing {} from {} until local media is ready", signal.getType(), from);
                    return;
                }
                link = ensureLink(from);
            }
        }
        link.handleSignal(signal);
    }

    @Override
    public void onLocationUpdate(LocationMessage location) {
        String userId = location.getUserId();
        if (userId == null || userId.equals(localId) || location.getLat() == null || location.getLng() == null) {
            return;
        }
        log.debug("Location update from {}: {}, {}", userId, location.getLat(), location.getLng());
        locationDisplay.upsert(userId, new LatLng(location.getLat(), location.getLng()));
    }

    @Override
    public void onDisconnected() {
        log.warn("Disconnected from relay");
        synchronized (lock) {
            resetRoom();
            roomId = null;
        }
    }

    public String getLocalId() { return localId; }

    public Optional<String> getRoomId() { return Optional.ofNullable(roomId); }

    public boolean isMediaReady() { return localStream != null; }

    public Optional<PeerLink> getPeer(String participantId) {
        return Optional.ofNullable(peers.get(participantId));
    }

    public Set<String> getPeerIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(peers.keySet()));
    }

    /**
     * Current membership view, this client included.
     */
    public Set<String> getRoomMembers() {
        synchronized (lock) {
            return roomMembersLocked();
        }
    }

    public Set<String> getPendingPeers() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(pendingPeers));
        }
    }

    private void onLocalMediaReady(MediaStream stream) {
        List<PeerLink> toOffer = new ArrayList<>();
        synchronized (lock) {
            localStream = stream;
            log.info("Camera and microphone enabled");
            if (roomId == null) {
                return;
            }
            for (String member : members) {
                PeerLink link = ensureLink(member);
                List<Signal> queued = pendingSignals.remove(member);
                if (queued != null) {
                    log.info("Replaying {} queued signals from {}", queued.size(), member);
                    queued.forEach(link::handleSignal);
                }
                toOffer.add(link);
            }
            pendingPeers.clear();
            pendingSignals.clear();
        }
        offerWhereNeeded(toOffer);
    }

    private void offerWhereNeeded(List<PeerLink> links) {
        for (PeerLink link : links) {
            if (!link.hasSentOffer()) {
                link.offer();
            }
        }
    }

    // Caller holds the lock.
    private PeerLink ensureLink(String remoteId) {
        PeerLink existing = peers.get(remoteId);
        if (existing != null) {
            return existing;
        }
        PeerLink link = new PeerLink(localId, remoteId, transportFactory, localStream,
                this::sendSignal, linkListener, linkOptions, scheduler);
        peers.put(remoteId, link);
        pendingPeers.remove(remoteId);
        log.debug("Peer link created: {} -> {}", localId, remoteId);
        return link;
    }

    // Caller holds the lock.
    private void resetRoom() {
        List<PeerLink> links = new ArrayList<>(peers.values());
        Set<String> former = new HashSet<>(members);
        peers.clear();
        members.clear();
        pendingPeers.clear();
        pendingSignals.clear();
        links.forEach(this::discard);
        for (String participantId : former) {
            locationDisplay.remove(participantId);
        }
    }

    private void discard(PeerLink link) {
        link.close();
        videoDisplay.remove(link.getRemoteId());
    }

    private Set<String> roomMembersLocked() {
        Set<String> view = new LinkedHashSet<>();
        if (localId != null) {
            view.add(localId);
        }
        view.addAll(members);
        return Collections.unmodifiableSet(view);
    }

    private void sendSignal(String remoteId, Signal signal) {
        String currentRoom = roomId;
        if (currentRoom == null) {
            log.debug("Dropping {} for {}: not in a room", signal, remoteId);
            return;
        }
        Map<String, Object> payload = objectMapper.convertValue(signal, PAYLOAD_TYPE);
        channel.sendSignal(new SignalEnvelope(currentRoom, localId, remoteId, payload));
    }

    private void requireConnected() {
        if (localId == null) {
            throw new IllegalStateException("Not connected to the relay");
        }
    }

    private static MediaAcquisitionException asMediaFailure(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof MediaAcquisitionException) {
            return (MediaAcquisitionException) cause;
        }
        return new MediaAcquisitionException("Could not access camera/microphone: " + cause.getMessage(), cause);
    }

    private final class LinkListener implements PeerLink.Listener {

        @Override
        public void onStateChanged(String remoteId, PeerLinkState state) {
            log.debug("Peer link with {} is now {}", remoteId, state);
            sessionListener.onPeerStateChanged(remoteId, state);
        }

        @Override
        public void onRemoteStream(String remoteId, MediaStream stream) {
            if (remoteId.equals(localId)) {
                log.warn("Ignoring own stream as remote video");
                return;
            }
            videoDisplay.upsert(remoteId, stream);
        }

        @Override
        public void onTransportStateChanged(String remoteId, TransportState state) {
            if (state == TransportState.FAILED) {
                log.warn("Transport to {} reported failure", remoteId);
            }
        }
    }

    public static final class Builder {
        private SignalingChannel channel;
        private PeerTransportFactory transportFactory;
        private LocalMediaSource mediaSource;
        private PresenceDisplay<MediaStream> videoDisplay = PresenceDisplay.none();
        private PresenceDisplay<LatLng> locationDisplay = PresenceDisplay.none();
        private SessionListener sessionListener = new SessionListener() { };
        private PeerLinkOptions linkOptions = PeerLinkOptions.defaults();
        private ScheduledExecutorService scheduler;
        private ObjectMapper objectMapper = new ObjectMapper();

        private Builder() {}

        public Builder channel(SignalingChannel channel) {
            this.channel = channel;
            return this;
        }

        public Builder transportFactory(PeerTransportFactory transportFactory) {
            this.transportFactory = transportFactory;
            return this;
        }

        public Builder mediaSource(LocalMediaSource mediaSource) {
            this.mediaSource = mediaSource;
            return this;
        }

        public Builder videoDisplay(PresenceDisplay<MediaStream> videoDisplay) {
            this.videoDisplay = Objects.requireNonNull(videoDisplay);
            return this;
        }

        public Builder locationDisplay(PresenceDisplay<LatLng> locationDisplay) {
            this.locationDisplay = Objects.requireNonNull(locationDisplay);
            return this;
        }

        public Builder sessionListener(SessionListener sessionListener) {
            this.sessionListener = Objects.requireNonNull(sessionListener);
            return this;
        }

        public Builder linkOptions(PeerLinkOptions linkOptions) {
            this.linkOptions = Objects.requireNonNull(linkOptions);
            return this;
        }

        /**
         * Scheduler for negotiation timeouts. When not set the client creates and owns one.
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = Objects.requireNonNull(objectMapper);
            return this;
        }

        public SessionClient build() {
            return new SessionClient(this);
        }
    }
}
