package com.projectgroup5.dogfight.replication;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProjectileDelta {
    @JsonProperty("i")
    private String id;
    @JsonProperty("o")
    private String ownerId;
    @JsonProperty("w")
    private String weapon;
    @JsonProperty("p")
    private double[] position;
    @JsonProperty("dir")
    private double[] direction;
    @JsonProperty("sp")
    private Double speed;
    @JsonProperty("dmg")
    private Integer damage;
    @JsonProperty("t")
    private Long spawnTick;
    @JsonProperty("ss")
    private Boolean serverSimulated;

    public ProjectileDelta() {
    }

    public ProjectileDelta(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public String getWeapon() {
        return weapon;
    }

    public void setWeapon(String weapon) {
        this.weapon = weapon;
    }

    public double[] getPosition() {
        return position;
    }

    public void setPosition(double[] position) {
        this.position = position;
    }

    public double[] getDirection() {
        return direction;
    }

    public void setDirection(double[] direction) {
        this.direction = direction;
    }

    public Double getSpeed() {
        return speed;
    }

    public void setSpeed(Double speed) {
        this.speed = speed;
    }

    public Integer getDamage() {
        return damage;
    }

    public void setDamage(Integer damage) {
        this.damage = damage;
    }

    public Long getSpawnTick() {
        return spawnTick;
    }

    public void setSpawnTick(Long spawnTick) {
        this.spawnTick = spawnTick;
    }

    public Boolean getServerSimulated() {
        return serverSimulated;
    }

    public void setServerSimulated(Boolean serverSimulated) {
        this.serverSimulated = serverSimulated;
    }
}
