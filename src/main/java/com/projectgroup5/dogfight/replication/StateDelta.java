package com.projectgroup5.dogfight.replication;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 世界状态增量
 * full=true 时 baseTick 无意义，客户端直接替换整个世界
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StateDelta {
    @JsonProperty("tick")
    private long tick;
    @JsonProperty("base")
    private long baseTick = -1;
    @JsonProperty("full")
    private boolean full;
    @JsonProperty("ph")
    private String phase;
    @JsonProperty("pt")
    private Double phaseTimer;

    @JsonProperty("pl")
    private List<PlayerDelta> players;
    @JsonProperty("plx")
    private List<String> removedPlayers;
    @JsonProperty("pr")
    private List<ProjectileDelta> projectiles;
    @JsonProperty("prx")
    private List<String> removedProjectiles;
    @JsonProperty("co")
    private List<CollectibleDelta> collectibles;
    @JsonProperty("cox")
    private List<String> removedCollectibles;

    public long getTick() {
        return tick;
    }

    public void setTick(long tick) {
        this.tick = tick;
    }

    public long getBaseTick() {
        return baseTick;
    }

    public void setBaseTick(long baseTick) {
        this.baseTick = baseTick;
    }

    public boolean isFull() {
        return full;
    }

    public void setFull(boolean full) {
        this.full = full;
    }

    public String getPhase() {
        return phase;
    }

    public void setPhase(String phase) {
        this.phase = phase;
    }

    public Double getPhaseTimer() {
        return phaseTimer;
    }

    public void setPhaseTimer(Double phaseTimer) {
        this.phaseTimer = phaseTimer;
    }

    public List<PlayerDelta> getPlayers() {
        return players;
    }

    public void setPlayers(List<PlayerDelta> players) {
        this.players = players;
    }

    public List<String> getRemovedPlayers() {
        return removedPlayers;
    }

    public void setRemovedPlayers(List<String> removedPlayers) {
        this.removedPlayers = removedPlayers;
    }

    public List<ProjectileDelta> getProjectiles() {
        return projectiles;
    }

    public void setProjectiles(List<ProjectileDelta> projectiles) {
        this.projectiles = projectiles;
    }

    public List<String> getRemovedProjectiles() {
        return removedProjectiles;
    }

    public void setRemovedProjectiles(List<String> removedProjectiles) {
        this.removedProjectiles = removedProjectiles;
    }

    public List<CollectibleDelta> getCollectibles() {
        return collectibles;
    }

    public void setCollectibles(List<CollectibleDelta> collectibles) {
        this.collectibles = collectibles;
    }

    public List<String> getRemovedCollectibles() {
        return removedCollectibles;
    }

    public void setRemovedCollectibles(List<String> removedCollectibles) {
        this.removedCollectibles = removedCollectibles;
    }

    /** 除 tick 外没有任何变化 */
    @JsonIgnore
    public boolean isEmpty() {
        return !full && phase == null && phaseTimer == null
                && players == null && removedPlayers == null
                && projectiles == null && removedProjectiles == null
                && collectibles == null && removedCollectibles == null;
    }
}
