package com.projectgroup5.dogfight.protocol;

public class JoinMessage extends ClientMessage {
    private long roomId;
    private String name;
    private String token;
    private String shipClass;

    public JoinMessage() {
    }

    public JoinMessage(long roomId, String name, String shipClass) {
        this.roomId = roomId;
        this.name = name;
        this.shipClass = shipClass;
    }

    @Override
    public ClientMessageType getMessageType() {
        return ClientMessageType.JOIN;
    }

    @Override
    public void validate() {
        if (roomId <= 0) {
            throw new ValidationException("roomId must be positive");
        }
    }

    public long getRoomId() {
        return roomId;
    }

    public void setRoomId(long roomId) {
        this.roomId = roomId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getShipClass() {
        return shipClass;
    }

    public void setShipClass(String shipClass) {
        this.shipClass = shipClass;
    }
}
