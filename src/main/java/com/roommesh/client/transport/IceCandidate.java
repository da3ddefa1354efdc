package com.roommesh.client.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public class IceCandidate {
    private String candidate;
    private String sdpMid;
    private Integer sdpMLineIndex;

    public IceCandidate() {}

    public IceCandidate(String candidate, String sdpMid, Integer sdpMLineIndex) {
        this.candidate = candidate;
        this.sdpMid = sdpMid;
        this.sdpMLineIndex = sdpMLineIndex;
    }

    public String getCandidate() { return candidate; }
    public void setCandidate(String candidate) { this.candidate = candidate; }

    public String getSdpMid() { return sdpMid; }
    public void setSdpMid(String sdpMid) { this.sdpMid = sdpMid; }

    public Integer getSdpMLineIndex() { return sdpMLineIndex; }
    public void setSdpMLineIndex(Integer sdpMLineIndex) { this.sdpMLineIndex = sdpMLineIndex; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IceCandidate)) return false;
        IceCandidate other = (IceCandidate) o;
        return Objects.equals(candidate, other.candidate)
                && Objects.equals(sdpMid, other.sdpMid)
                && Objects.equals(sdpMLineIndex, other.sdpMLineIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidate, sdpMid, sdpMLineIndex);
    }

    @Override
    public String toString() {
        return sdpMid + ":" + sdpMLineIndex + ":" + candidate;
    }
}
