package com.roommesh.client;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.roommesh.client.transport.IceCandidate;
import com.roommesh.client.transport.SessionDescription;

/**
 * Body of a {@code webrtc-signal}: a session description ({@code offer}/{@code answer}) or a
 * {@code candidate}. Shaped like the browser's RTCSessionDescription so both kinds of client can
 * talk to each other.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Signal {
    public static final String OFFER = "offer";
    public static final String ANSWER = "answer";
    public static final String CANDIDATE = "candidate";

    private String type;
    private String sdp;
    private IceCandidate candidate;

    public Signal() {}

    private Signal(String type, String sdp, IceCandidate candidate) {
        this.type = type;
        this.sdp = sdp;
        this.candidate = candidate;
    }

    public static Signal description(SessionDescription description) {
        return new Signal(description.getType().canonicalForm(), description.getSdp(), null);
    }

    public static Signal candidate(IceCandidate candidate) {
        return new Signal(CANDIDATE, null, candidate);
    }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getSdp() { return sdp; }
    public void setSdp(String sdp) { this.sdp = sdp; }

    public IceCandidate getCandidate() { return candidate; }
    public void setCandidate(IceCandidate candidate) { this.candidate = candidate; }

    @JsonIgnore
    public SessionDescription toSessionDescription() {
        return new SessionDescription(SessionDescription.Type.fromCanonicalForm(type), sdp);
    }

    @Override
    public String toString() {
        return type;
    }
}
