package com.roommesh.dto;

/**
 * Event names of the relay protocol. Clients send to {@code /app/<event>} and receive on
 * {@code /user/queue/<event>}.
 */
public final class SignalingEvents {
    public static final String JOIN_ROOM = "join-room";
    public static final String LEAVE_ROOM = "leave-room";
    public static final String ROOM_STATE = "room-state";
    public static final String USER_JOINED = "user-joined";
    public static final String USER_LEFT = "user-left";
    public static final String WEBRTC_SIGNAL = "webrtc-signal";
    public static final String LOCATION_UPDATE = "location-update";

    public static final String APP_PREFIX = "/app";
    public static final String USER_QUEUE_PREFIX = "/queue/";

    private SignalingEvents() {}

    public static String userQueue(String event) {
        return USER_QUEUE_PREFIX + event;
    }
}
