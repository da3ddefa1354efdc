package com.roommesh.service;

import com.roommesh.dto.SignalingEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Sends events to {@code /user/queue/<event>} of the participant's STOMP session.
 */
@Service
public class StompParticipantMessenger implements ParticipantMessenger {
    private static final Logger log = LoggerFactory.getLogger(StompParticipantMessenger.class);

    private final SimpMessagingTemplate messagingTemplate;

    public StompParticipantMessenger(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @Override
    public void send(String participantId, String event, Object payload) {
        messagingTemplate.convertAndSendToUser(participantId, SignalingEvents.userQueue(event), payload);
        log.debug("{} sent to {}", event, participantId);
    }
}
