package com.projectgroup5.dogfight.protocol;

public class PickupMessage extends ServerMessage {
    private String playerId;
    private String collectibleId;
    private String collectibleType;
    private long tick;

    public PickupMessage() {
    }

    public PickupMessage(String playerId, String collectibleId, String collectibleType, long tick) {
        this.playerId = playerId;
        this.collectibleId = collectibleId;
        this.collectibleType = collectibleType;
        this.tick = tick;
    }

    public String getPlayerId() {
        return playerId;
    }

    public void setPlayerId(String playerId) {
        this.playerId = playerId;
    }

    public String getCollectibleId() {
        return collectibleId;
    }

    public void setCollectibleId(String collectibleId) {
        this.collectibleId = collectibleId;
    }

    public String getCollectibleType() {
        return collectibleType;
    }

    public void setCollectibleType(String collectibleType) {
        this.collectibleType = collectibleType;
    }

    public long getTick() {
        return tick;
    }

    public void setTick(long tick) {
        this.tick = tick;
    }
}
