package com.roommesh.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class LocationMessage {
    private String roomId;
    private String userId;
    private Double lat;
    private Double lng;

    public LocationMessage() {}

    public LocationMessage(String roomId, String userId, Double lat, Double lng) {
        this.roomId = roomId;
        this.userId = userId;
        this.lat = lat;
        this.lng = lng;
    }

    public String getRoomId() { return roomId; }
    public void setRoomId(String roomId) { this.roomId = roomId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public Double getLat() { return lat; }
    public void setLat(Double lat) { this.lat = lat; }

    public Double getLng() { return lng; }
    public void setLng(Double lng) { this.lng = lng; }
}
