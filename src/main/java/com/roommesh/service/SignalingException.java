package com.roommesh.service;

/**
 * A malformed or unroutable relay request. The request is dropped; the sender is never told.
 */
public class SignalingException extends RuntimeException {
    private final String participantId;

    public SignalingException(String participantId, String message) {
        super(message);
        this.participantId = participantId;
    }

    public String getParticipantId() {
        return participantId;
    }
}
