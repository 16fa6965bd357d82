package com.projectgroup5.dogfight.replication;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 玩家字段增量：null 表示未变化；新出现的玩家所有字段都有值
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlayerDelta {
    @JsonProperty("i")
    private String id;
    @JsonProperty("n")
    private String name;
    @JsonProperty("c")
    private String shipClass;
    @JsonProperty("p")
    private double[] position;
    @JsonProperty("r")
    private double[] rotation;
    @JsonProperty("v")
    private double[] velocity;
    @JsonProperty("h")
    private Double health;
    @JsonProperty("mh")
    private Double maxHealth;
    @JsonProperty("k")
    private Integer kills;
    @JsonProperty("d")
    private Integer deaths;
    @JsonProperty("m")
    private Integer missiles;
    @JsonProperty("mm")
    private Integer maxMissiles;
    @JsonProperty("lu")
    private Boolean laserUpgrade;
    @JsonProperty("a")
    private Boolean alive;
    @JsonProperty("s")
    private Long lastAckedInputSeq;
    @JsonProperty("bf")
    private Double boostFuel;
    @JsonProperty("b")
    private Boolean boosting;

    public PlayerDelta() {
    }

    public PlayerDelta(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
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

    public double[] getPosition() {
        return position;
    }

    public void setPosition(double[] position) {
        this.position = position;
    }

    public double[] getRotation() {
        return rotation;
    }

    public void setRotation(double[] rotation) {
        this.rotation = rotation;
    }

    public double[] getVelocity() {
        return velocity;
    }

    public void setVelocity(double[] velocity) {
        this.velocity = velocity;
    }

    public Double getHealth() {
        return health;
    }

    public void setHealth(Double health) {
        this.health = health;
    }

    public Double getMaxHealth() {
        return maxHealth;
    }

    public void setMaxHealth(Double maxHealth) {
        this.maxHealth = maxHealth;
    }

    public Integer getKills() {
        return kills;
    }

    public void setKills(Integer kills) {
        this.kills = kills;
    }

    public Integer getDeaths() {
        return deaths;
    }

    public void setDeaths(Integer deaths) {
        this.deaths = deaths;
    }

    public Integer getMissiles() {
        return missiles;
    }

    public void setMissiles(Integer missiles) {
        this.missiles = missiles;
    }

    public Integer getMaxMissiles() {
        return maxMissiles;
    }

    public void setMaxMissiles(Integer maxMissiles) {
        this.maxMissiles = maxMissiles;
    }

    public Boolean getLaserUpgrade() {
        return laserUpgrade;
    }

    public void setLaserUpgrade(Boolean laserUpgrade) {
        this.laserUpgrade = laserUpgrade;
    }

    public Boolean getAlive() {
        return alive;
    }

    public void setAlive(Boolean alive) {
        this.alive = alive;
    }

    public Long getLastAckedInputSeq() {
        return lastAckedInputSeq;
    }

    public void setLastAckedInputSeq(Long lastAckedInputSeq) {
        this.lastAckedInputSeq = lastAckedInputSeq;
    }

    public Double getBoostFuel() {
        return boostFuel;
    }

    public void setBoostFuel(Double boostFuel) {
        this.boostFuel = boostFuel;
    }

    public Boolean getBoosting() {
        return boosting;
    }

    public void setBoosting(Boolean boosting) {
        this.boosting = boosting;
    }
}
