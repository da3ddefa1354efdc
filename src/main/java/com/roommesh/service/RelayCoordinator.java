package com.roommesh.service;

import com.roommesh.dto.LocationMessage;
import com.roommesh.dto.ParticipantEvent;
import com.roommesh.dto.RoomStateMessage;
import com.roommesh.dto.SignalEnvelope;
import com.roommesh.dto.SignalingEvents;
import com.roommesh.model.LatLng;
import com.roommesh.repository.RoomRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Server-side authority for room membership and signaling fan-out.
 * <p>
 * Each operation belongs to one connection, identified by the participant id assigned at
 * handshake. Operations of one connection are serialized on its {@link Connection} record; room
 * mutations and the events they cause run inside the room's region of {@link RoomRegistry}, so
 * every member observes membership changes of a room in the same order. Requests that cannot be
 * routed are rejected with a {@link SignalingException} and nothing is sent.
 */
@Service
public class RelayCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RelayCoordinator.class);

    private final RoomRegistry roomRegistry;
    private final ParticipantMessenger messenger;
    private final ConcurrentMap<String, Connection> connections = new ConcurrentHashMap<>();

    public RelayCoordinator(RoomRegistry roomRegistry, ParticipantMessenger messenger) {
        this.roomRegistry = roomRegistry;
        this.messenger = messenger;
    }

    private static final class Connection {
        private final String participantId;
        private String roomId;
        private boolean closed;

        private Connection(String participantId) {
            this.participantId = participantId;
        }
    }

    public void connect(String participantId) {
        if (connections.putIfAbsent(participantId, new Connection(participantId)) == null) {
            log.info("Participant connected: {}", participantId);
        }
    }

    /**
     * Moves the connection into {@code requestedRoomId}, leaving its previous room first. Other
     * members learn about the joiner before the joiner receives its snapshot, and the snapshot
     * never lists the joiner itself.
     */
    public void join(String participantId, String requestedRoomId) {
        String roomId = normalizeRoomId(participantId, requestedRoomId);
        Connection connection = requireConnection(participantId);
        synchronized (connection) {
            ensureOpen(connection);
            if (connection.roomId != null) {
                leaveRoom(connection);
            }
            connection.roomId = roomId;
            roomRegistry.withRoomOrCreate(roomId, room -> {
                room.addParticipant(participantId);
                List<String> others = room.otherParticipants(participantId);
                ParticipantEvent joined = new ParticipantEvent(participantId);
                for (String other : others) {
                    deliver(other, SignalingEvents.USER_JOINED, joined);
                }
                deliver(participantId, SignalingEvents.ROOM_STATE, new RoomStateMessage(others, room.getLocations()));
                log.info("User {} joined room {} ({} participants)", participantId, roomId, room.size());
                return null;
            });
        }
    }

    /**
     * Forwards a signal to {@code envelope.to}, or to every other member of the room when no
     * target is given. The caller must currently be registered in {@code envelope.roomId}.
     */
    public void relay(String participantId, SignalEnvelope envelope) {
        if (envelope == null || envelope.getSignal() == null) {
            throw new SignalingException(participantId, "Signal without payload");
        }
        Connection connection = requireConnection(participantId);
        synchronized (connection) {
            ensureOpen(connection);
            String roomId = requireRoom(connection, envelope.getRoomId(), "signal");
            SignalEnvelope forwarded = new SignalEnvelope(roomId, participantId, null, envelope.getSignal());
            String target = envelope.getTo();

            if (target != null && !target.isEmpty()) {
                if (target.equals(participantId)) {
                    throw new SignalingException(participantId, "Signal addressed to its own sender");
                }
                if (!connections.containsKey(target)) {
                    throw new SignalingException(participantId, "Unknown signal target " + target);
                }
                messenger.send(target, SignalingEvents.WEBRTC_SIGNAL, forwarded);
                log.debug("Signal {} forwarded from {} to {}", forwarded, participantId, target);
                return;
            }

            int recipients = roomRegistry.withRoom(roomId, room -> {
                List<String> others = room.otherParticipants(participantId);
                for (String other : others) {
                    deliver(other, SignalingEvents.WEBRTC_SIGNAL, forwarded);
                }
                return others.size();
            }).orElse(0);
            log.debug("Signal {} broadcast from {} to {} participants", forwarded, participantId, recipients);
        }
    }

    /**
     * Stores the caller's latest location and shares it with the rest of the room.
     */
    public void locationUpdate(String participantId, LocationMessage message) {
        if (message == null || message.getLat() == null || message.getLng() == null) {
            throw new SignalingException(participantId, "Location update without coordinates");
        }
        Connection connection = requireConnection(participantId);
        synchronized (connection) {
            ensureOpen(connection);
            String roomId = requireRoom(connection, message.getRoomId(), "update location");
            LatLng location = new LatLng(message.getLat(), message.getLng());
            LocationMessage update = new LocationMessage(roomId, participantId, message.getLat(), message.getLng());

            boolean stored = roomRegistry.withRoom(roomId, room -> {
                if (!room.updateLocation(participantId, location)) {
                    return false;
                }
                for (String other : room.otherParticipants(participantId)) {
                    deliver(other, SignalingEvents.LOCATION_UPDATE, update);
                }
                return true;
            }).orElse(false);

            if (!stored) {
                throw new SignalingException(participantId, "Room " + roomId + " no longer exists");
            }
            log.debug("Location of {} in room {} set to {}", participantId, roomId, location);
        }
    }

    /**
     * Explicit leave; the connection stays usable for a later join.
     */
    public void leave(String participantId) {
        Connection connection = requireConnection(participantId);
        synchronized (connection) {
            ensureOpen(connection);
            if (connection.roomId == null) {
                log.debug("Participant {} asked to leave but is in no room", participantId);
                return;
            }
            leaveRoom(connection);
        }
    }

    /**
     * Transport teardown. Safe to call more than once; only the first call has an effect.
     */
    public void disconnect(String participantId) {
        Connection connection = connections.remove(participantId);
        if (connection == null) {
            return;
        }
        synchronized (connection) {
            connection.closed = true;
            if (connection.roomId != null) {
                leaveRoom(connection);
            }
        }
        log.info("Participant disconnected: {}", participantId);
    }

    public Optional<String> currentRoom(String participantId) {
        Connection connection = connections.get(participantId);
        if (connection == null) {
            return Optional.empty();
        }
        synchronized (connection) {
            return Optional.ofNullable(connection.roomId);
        }
    }

    public boolean isConnected(String participantId) {
        return connections.containsKey(participantId);
    }

    // Caller holds the connection's monitor.
    private void leaveRoom(Connection connection) {
        String roomId = connection.roomId;
        String participantId = connection.participantId;
        connection.roomId = null;

        roomRegistry.withRoom(roomId, room -> {
            if (!room.removeParticipant(participantId)) {
                return null;
            }
            ParticipantEvent left = new ParticipantEvent(participantId);
            for (String other : room.getParticipants()) {
                deliver(other, SignalingEvents.USER_LEFT, left);
            }
            log.info("User {} left room {} ({} remaining)", participantId, roomId, room.size());
            return null;
        });
    }

    // Runs inside a room region: a failed delivery must not abort the region's membership change.
    private void deliver(String participantId, String event, Object payload) {
        try {
            messenger.send(participantId, event, payload);
        } catch (RuntimeException e) {
            log.warn("Could not deliver {} to {}: {}", event, participantId, e.getMessage());
        }
    }

    private Connection requireConnection(String participantId) {
        Connection connection = participantId != null ? connections.get(participantId) : null;
        if (connection == null) {
            throw new SignalingException(participantId, "Unknown connection " + participantId);
        }
        return connection;
    }

    private void ensureOpen(Connection connection) {
        if (connection.closed) {
            throw new SignalingException(connection.participantId, "Connection already closed");
        }
    }

    private String requireRoom(Connection connection, String claimedRoomId, String action) {
        if (connection.roomId == null || !connection.roomId.equals(claimedRoomId)) {
            throw new SignalingException(connection.participantId, String.format(
                    "User %s tried to %s in room %s but is in %s",
                    connection.participantId, action, claimedRoomId, connection.roomId));
        }
        return connection.roomId;
    }

    private static String normalizeRoomId(String participantId, String roomId) {
        String trimmed = roomId != null ? roomId.trim() : "";
        if (trimmed.isEmpty()) {
            throw new SignalingException(participantId, "Room name must not be blank");
        }
        return trimmed;
    }
}
