package com.projectgroup5.dogfight.protocol;

public class PhaseChangedMessage extends ServerMessage {
    private String phase;
    private String previous;
    private double timer;
    // 只在进入 RESULTS 时有值
    private String winnerId;
    private long tick;

    public PhaseChangedMessage() {
    }

    public PhaseChangedMessage(String phase, String previous, double timer, String winnerId, long tick) {
        this.phase = phase;
        this.previous = previous;
        this.timer = timer;
        this.winnerId = winnerId;
        this.tick = tick;
    }

    public String getPhase() {
        return phase;
    }

    public void setPhase(String phase) {
        this.phase = phase;
    }

    public String getPrevious() {
        return previous;
    }

    public void setPrevious(String previous) {
        this.previous = previous;
    }

    public double getTimer() {
        return timer;
    }

    public void setTimer(double timer) {
        this.timer = timer;
    }

    public String getWinnerId() {
        return winnerId;
    }

    public void setWinnerId(String winnerId) {
        this.winnerId = winnerId;
    }

    public long getTick() {
        return tick;
    }

    public void setTick(long tick) {
        this.tick = tick;
    }
}
