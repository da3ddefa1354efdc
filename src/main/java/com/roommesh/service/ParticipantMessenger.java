package com.roommesh.service;

/**
 * Delivers a relay event to one connected participant.
 */
public interface ParticipantMessenger {

    void send(String participantId, String event, Object payload);
}
