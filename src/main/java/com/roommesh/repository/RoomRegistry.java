package com.roommesh.repository;

import com.roommesh.model.ParticipantLocation;
import com.roommesh.model.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Process-scoped registry of live rooms.
 * <p>
 * Every action on a room runs inside that room's exclusive region (the key's
 * {@link ConcurrentMap#compute} slot), so joins, leaves and location updates of one room never
 * interleave. A room exists here iff it has at least one participant: it is created on demand by
 * {@link #withRoomOrCreate} and dropped in the same region that removes its last participant.
 * Actions must not call back into the registry.
 */
@Repository
public class RoomRegistry {
    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final ConcurrentMap<String, Room> rooms = new ConcurrentHashMap<>();

    public <T> T withRoomOrCreate(String roomId, Function<Room, T> action) {
        AtomicReference<T> result = new AtomicReference<>();
        rooms.compute(roomId, (id, room) -> {
            Room target = room != null ? room : new Room(id);
            result.set(action.apply(target));
            return retain(target, room == null);
        });
        return result.get();
    }

    /**
     * Runs {@code action} on an existing room; empty if the room is not registered.
     */
    public <T> Optional<T> withRoom(String roomId, Function<Room, T> action) {
        AtomicReference<T> result = new AtomicReference<>();
        rooms.computeIfPresent(roomId, (id, room) -> {
            result.set(action.apply(room));
            return retain(room, false);
        });
        return Optional.ofNullable(result.get());
    }

    public Set<String> members(String roomId) {
        return this.<Set<String>>withRoom(roomId, room -> new LinkedHashSet<>(room.getParticipants()))
                .orElse(Collections.emptySet());
    }

    public List<ParticipantLocation> locations(String roomId) {
        return withRoom(roomId, Room::getLocations).orElse(Collections.emptyList());
    }

    public int participantCount(String roomId) {
        return withRoom(roomId, Room::size).orElse(0);
    }

    public boolean exists(String roomId) {
        return rooms.containsKey(roomId);
    }

    public Set<String> roomIds() {
        return new TreeSet<>(rooms.keySet());
    }

    public int roomCount() {
        return rooms.size();
    }

    private Room retain(Room room, boolean created) {
        if (room.isEmpty()) {
            if (!created) {
                log.info("Room {} deleted (empty)", room.getId());
            }
            return null;
        }
        if (created) {
            log.info("Room {} created", room.getId());
        }
        return room;
    }
}
