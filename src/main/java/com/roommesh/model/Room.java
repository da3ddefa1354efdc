package com.roommesh.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Live membership of one named room.
 * <p>
 * Not thread-safe: instances are only touched inside the room's exclusive region of
 * {@link com.roommesh.repository.RoomRegistry}.
 */
public class Room {
    private final String id;
    private final Set<String> participants = new LinkedHashSet<>();
    private final Map<String, LatLng> locations = new LinkedHashMap<>();

    public Room(String id) {
        this.id = id;
    }

    public String getId() { return id; }

    public Set<String> getParticipants() { return Collections.unmodifiableSet(participants); }

    public boolean addParticipant(String participantId) {
        return participants.add(participantId);
    }

    /**
     * Removes the participant together with its last known location.
     */
    public boolean removeParticipant(String participantId) {
        locations.remove(participantId);
        return participants.remove(participantId);
    }

    public boolean hasParticipant(String participantId) {
        return participants.contains(participantId);
    }

    public boolean isEmpty() {
        return participants.isEmpty();
    }

    public int size() {
        return participants.size();
    }

    /**
     * Latest-wins; locations of non-members are refused.
     */
    public boolean updateLocation(String participantId, LatLng location) {
        if (!participants.contains(participantId)) {
            return false;
        }
        locations.put(participantId, location);
        return true;
    }

    public List<String> otherParticipants(String participantId) {
        List<String> others = new ArrayList<>(participants.size());
        for (String id : participants) {
            if (!id.equals(participantId)) {
                others.add(id);
            }
        }
        return others;
    }

    public List<ParticipantLocation> getLocations() {
        List<ParticipantLocation> result = new ArrayList<>(locations.size());
        locations.forEach((userId, location) ->
                result.add(new ParticipantLocation(userId, location.getLat(), location.getLng())));
        return result;
    }
}
