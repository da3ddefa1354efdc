package com.roommesh.dto;

import com.roommesh.model.ParticipantLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot sent to a participant right after it joins. {@code users} never contains the
 * recipient.
 */
public class RoomStateMessage {
    private List<String> users = new ArrayList<>();
    private List<ParticipantLocation> locations = new ArrayList<>();

    public RoomStateMessage() {}

    public RoomStateMessage(List<String> users, List<ParticipantLocation> locations) {
        this.users = users;
        this.locations = locations;
    }

    public List<String> getUsers() { return users; }
    public void setUsers(List<String> users) { this.users = users; }

    public List<ParticipantLocation> getLocations() { return locations; }
    public void setLocations(List<ParticipantLocation> locations) { this.locations = locations; }
}
