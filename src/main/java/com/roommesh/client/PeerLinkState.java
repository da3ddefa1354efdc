package com.roommesh.client;

public enum PeerLinkState {
    IDLE,
    OFFERING,
    /** A description was exchanged; waiting for the answer or for the transport to connect. */
    AWAITING_ANSWER,
    CONNECTED,
    FAILED,
    CLOSED;

    public boolean isTerminal() {
        return this == FAILED || this == CLOSED;
    }
}
