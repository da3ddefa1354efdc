package com.roommesh.dto;

/**
 * Payload of {@code user-joined} and {@code user-left}.
 */
public class ParticipantEvent {
    private String userId;

    public ParticipantEvent() {}

    public ParticipantEvent(String userId) {
        this.userId = userId;
    }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    @Override
    public String toString() {
        return "ParticipantEvent{userId=" + userId + "}";
    }
}
