package com.roommesh.client;

import java.util.Set;

/**
 * Status notifications of a {@link SessionClient}, typically wired to a user interface.
 */
public interface SessionListener {

    default void onMembershipChanged(Set<String> members) {
    }

    default void onPeerStateChanged(String participantId, PeerLinkState state) {
    }
}
