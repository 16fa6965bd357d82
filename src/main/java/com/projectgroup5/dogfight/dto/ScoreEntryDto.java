package com.projectgroup5.dogfight.dto;

import com.projectgroup5.dogfight.replication.PlayerState;

public class ScoreEntryDto {

    private String playerId;
    private String name;
    private String shipClass;
    private double health;
    private int kills;
    private int deaths;
    private boolean alive;

    public ScoreEntryDto() {
    }

    public static ScoreEntryDto from(PlayerState state) {
        ScoreEntryDto dto = new ScoreEntryDto();
        dto.setPlayerId(state.getId());
        dto.setName(state.getName());
        dto.setShipClass(state.getShipClass());
        dto.setHealth(state.getHealth());
        dto.setKills(state.getKills());
        dto.setDeaths(state.getDeaths());
        dto.setAlive(state.isAlive());
        return dto;
    }

    public String getPlayerId() {
        return playerId;
    }

    public void setPlayerId(String playerId) {
        this.playerId = playerId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getShipClass() {
        return shipClass;
    }

    public void setShipClass(String shipClass) {
        this.shipClass = shipClass;
    }

    public double getHealth() {
        return health;
    }

    public void setHealth(double health) {
        this.health = health;
    }

    public int getKills() {
        return kills;
    }

    public void setKills(int kills) {
        this.kills = kills;
    }

    public int getDeaths() {
        return deaths;
    }

    public void setDeaths(int deaths) {
        this.deaths = deaths;
    }

    public boolean isAlive() {
        return alive;
    }

    public void setAlive(boolean alive) {
        this.alive = alive;
    }
}
