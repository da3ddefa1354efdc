package com.roommesh.controller;

import com.roommesh.service.RelayCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

/**
 * Maps STOMP session lifecycle onto relay connections. A closed session always runs the leave
 * procedure, whatever closed it.
 */
@Component
public class ConnectionEventListener {
    private static final Logger log = LoggerFactory.getLogger(ConnectionEventListener.class);

    private final RelayCoordinator relayCoordinator;

    public ConnectionEventListener(RelayCoordinator relayCoordinator) {
        this.relayCoordinator = relayCoordinator;
    }

    @EventListener
    public void onConnected(SessionConnectedEvent event) {
        Principal user = event.getUser();
        if (user == null) {
            log.warn("STOMP session connected without participant id");
            return;
        }
        relayCoordinator.connect(user.getName());
    }

    @EventListener
    public void onDisconnected(SessionDisconnectEvent event) {
        Principal user = event.getUser();
        if (user == null) {
            log.debug("Session {} closed before a participant id was assigned", event.getSessionId());
            return;
        }
        log.debug("Session {} closed with {}", event.getSessionId(), event.getCloseStatus());
        relayCoordinator.disconnect(user.getName());
    }
}
