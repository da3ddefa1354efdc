package com.roommesh.model;

/**
 * One entry of the {@code locations} list of a room-state snapshot.
 */
public class ParticipantLocation {
    private String userId;
    private double lat;
    private double lng;

    public ParticipantLocation() {}

    public ParticipantLocation(String userId, double lat, double lng) {
        this.userId = userId;
        this.lat = lat;
        this.lng = lng;
    }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public double getLat() { return lat; }
    public void setLat(double lat) { this.lat = lat; }

    public double getLng() { return lng; }
    public void setLng(double lng) { this.lng = lng; }
}
