package com.projectgroup5.dogfight.protocol;

public class KillMessage extends ServerMessage {
    private String killerId;
    private String victimId;
    private long tick;

    public KillMessage() {
    }

    public KillMessage(String killerId, String victimId, long tick) {
        this.killerId = killerId;
        this.victimId = victimId;
        this.tick = tick;
    }

    public String getKillerId() {
        return killerId;
    }

    public void setKillerId(String killerId) {
        this.killerId = killerId;
    }

    public String getVictimId() {
        return victimId;
    }

    public void setVictimId(String victimId) {
        this.victimId = victimId;
    }

    public long getTick() {
        return tick;
    }

    public void setTick(long tick) {
        this.tick = tick;
    }
}
