package com.roommesh.controller;

import com.roommesh.dto.JoinRoomRequest;
import com.roommesh.dto.LocationMessage;
import com.roommesh.dto.SignalEnvelope;
import com.roommesh.dto.SignalingEvents;
import com.roommesh.service.RelayCoordinator;
import com.roommesh.service.SignalingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;

import java.security.Principal;

@Controller
public class SignalingController {
    private static final Logger log = LoggerFactory.getLogger(SignalingController.class);

    private final RelayCoordinator relayCoordinator;

    public SignalingController(RelayCoordinator relayCoordinator) {
        this.relayCoordinator = relayCoordinator;
    }

    @MessageMapping(SignalingEvents.JOIN_ROOM)
    public void joinRoom(@Payload JoinRoomRequest request, Principal principal) {
        String participantId = participantId(principal);
        String roomId = request != null ? request.getRoomId() : null;
        log.info("User {} joining room {}", participantId, roomId);
        relayCoordinator.join(participantId, roomId);
    }

    @MessageMapping(SignalingEvents.LEAVE_ROOM)
    public void leaveRoom(Principal principal) {
        relayCoordinator.leave(participantId(principal));
    }

    @MessageMapping(SignalingEvents.WEBRTC_SIGNAL)
    public void signal(@Payload SignalEnvelope envelope, Principal principal) {
        relayCoordinator.relay(participantId(principal), envelope);
    }

    @MessageMapping(SignalingEvents.LOCATION_UPDATE)
    public void locationUpdate(@Payload LocationMessage message, Principal principal) {
        relayCoordinator.locationUpdate(participantId(principal), message);
    }

    @MessageExceptionHandler(SignalingException.class)
    public void handleSignalingError(SignalingException e) {
        log.warn("Dropped request from {}: {}", e.getParticipantId(), e.getMessage());
    }

    private static String participantId(Principal principal) {
        if (principal == null) {
            throw new SignalingException(null, "Message from a connection without participant id");
        }
        return principal.getName();
    }
}
