package com.projectgroup5.dogfight.dto;

import java.util.List;

public class RoomSummaryDto {
    private long roomId;
    private String phase;
    private double phaseTimer;
    private long tick;
    private int connections;
    private List<ScoreEntryDto> players;     // 按加入顺序

    public long getRoomId() {
        return roomId;
    }

    public void setRoomId(long roomId) {
        this.roomId = roomId;
    }

    public String getPhase() {
        return phase;
    }

    public void setPhase(String phase) {
        this.phase = phase;
    }

    public double getPhaseTimer() {
        return phaseTimer;
    }

    public void setPhaseTimer(double phaseTimer) {
        this.phaseTimer = phaseTimer;
    }

    public long getTick() {
        return tick;
    }

    public void setTick(long tick) {
        this.tick = tick;
    }

    public int getConnections() {
        return connections;
    }

    public void setConnections(int connections) {
        this.connections = connections;
    }

    public List<ScoreEntryDto> getPlayers() {
        return players;
    }

    public void setPlayers(List<ScoreEntryDto> players) {
        this.players = players;
    }
}
