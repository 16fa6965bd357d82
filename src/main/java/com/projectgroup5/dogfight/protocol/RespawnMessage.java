package com.projectgroup5.dogfight.protocol;

public class RespawnMessage extends ServerMessage {
    private String playerId;
    private double[] position;
    private long tick;

    public RespawnMessage() {
    }

    public RespawnMessage(String playerId, double[] position, long tick) {
        this.playerId = playerId;
        this.position = position;
        this.tick = tick;
    }

    public String getPlayerId() {
        return playerId;
    }

    public void setPlayerId(String playerId) {
        this.playerId = playerId;
    }

    public double[] getPosition() {
        return position;
    }

    public void setPosition(double[] position) {
        this.position = position;
    }

    public long getTick() {
        return tick;
    }

    public void setTick(long tick) {
        this.tick = tick;
    }
}
