package com.roommesh.config;

import java.security.Principal;
import java.util.Objects;

/**
 * Identity of one WebSocket connection; its name is the participant id.
 */
public final class ParticipantPrincipal implements Principal {
    private final String participantId;

    public ParticipantPrincipal(String participantId) {
        this.participantId = participantId;
    }

    @Override
    public String getName() {
        return participantId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParticipantPrincipal)) return false;
        return participantId.equals(((ParticipantPrincipal) o).participantId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(participantId);
    }

    @Override
    public String toString() {
        return "ParticipantPrincipal{" + participantId + "}";
    }
}
