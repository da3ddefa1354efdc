package com.roommesh.client.transport;

/**
 * Something that shows per-participant data: remote video tiles, map markers.
 */
public interface PresenceDisplay<T> {

    void upsert(String participantId, T data);

    void remove(String participantId);

    static <T> PresenceDisplay<T> none() {
        return new PresenceDisplay<T>() {
            @Override
            public void upsert(String participantId, T data) {
            }

            @Override
            public void remove(String participantId) {
            }
        };
    }
}
