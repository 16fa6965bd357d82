package com.projectgroup5.dogfight.protocol;

public class HitMessage extends ServerMessage {
    private String targetId;
    private double amount;
    private String attackerId;
    private String projectileId;
    private long tick;

    public HitMessage() {
    }

    public HitMessage(String targetId, double amount, String attackerId, String projectileId, long tick) {
        this.targetId = targetId;
        this.amount = amount;
        this.attackerId = attackerId;
        this.projectileId = projectileId;
        this.tick = tick;
    }

    public String getTargetId() {
        return targetId;
    }

    public void setTargetId(String targetId) {
        this.targetId = targetId;
    }

    public double getAmount() {
        return amount;
    }

    public void setAmount(double amount) {
        this.amount = amount;
    }

    public String getAttackerId() {
        return attackerId;
    }

    public void setAttackerId(String attackerId) {
        this.attackerId = attackerId;
    }

    public String getProjectileId() {
        return projectileId;
    }

    public void setProjectileId(String projectileId) {
        this.projectileId = projectileId;
    }

    public long getTick() {
        return tick;
    }

    public void setTick(long tick) {
        this.tick = tick;
    }
}
