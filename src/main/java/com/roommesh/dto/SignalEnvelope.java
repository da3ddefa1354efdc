package com.roommesh.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Routing wrapper of a {@code webrtc-signal}. The relay reads only {@code roomId} and
 * {@code to}; {@code signal} is forwarded untouched and {@code from} is always rewritten by the
 * relay.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SignalEnvelope {
    private String roomId;
    private String from;
    private String to;
    private Map<String, Object> signal;

    public SignalEnvelope() {}

    public SignalEnvelope(String roomId, String from, String to, Map<String, Object> signal) {
        this.roomId = roomId;
        this.from = from;
        this.to = to;
        this.signal = signal;
    }

    public String getRoomId() { return roomId; }
    public void setRoomId(String roomId) { this.roomId = roomId; }

    public String getFrom() { return from; }
    public void setFrom(String from) { this.from = from; }

    public String getTo() { return to; }
    public void setTo(String to) { this.to = to; }

    public Map<String, Object> getSignal() { return signal; }
    public void setSignal(Map<String, Object> signal) { this.signal = signal; }

    @Override
    public String toString() {
        return "SignalEnvelope{roomId=" + roomId + ", from=" + from + ", to=" + to
                + ", type=" + (signal != null ? signal.get("type") : null) + "}";
    }
}
