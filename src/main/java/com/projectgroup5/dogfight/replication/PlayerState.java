package com.projectgroup5.dogfight.replication;

import com.projectgroup5.dogfight.game.PlayerEntity;
import com.projectgroup5.dogfight.game.Vectors;

import java.util.Arrays;
import java.util.Objects;

/**
 * 某个 tick 时玩家的不可变快照
 */
public final class PlayerState {
    private final String id;
    private final String name;
    private final String shipClass;
    private final double[] position;
    private final double[] rotation;
    private final double[] velocity;
    private final double health;
    private final double maxHealth;
    private final int kills;
    private final int deaths;
    private final int missiles;
    private final int maxMissiles;
    private final boolean laserUpgrade;
    private final boolean alive;
    private final long lastAckedInputSeq;
    private final double boostFuel;
    private final boolean boosting;

    public PlayerState(String id, String name, String shipClass,
                       double[] position, double[] rotation, double[] velocity,
                       double health, double maxHealth, int kills, int deaths,
                       int missiles, int maxMissiles, boolean laserUpgrade, boolean alive,
                       long lastAckedInputSeq, double boostFuel, boolean boosting) {
        this.id = id;
        this.name = name;
        this.shipClass = shipClass;
        this.position = position.clone();
        this.rotation = rotation.clone();
        this.velocity = velocity.clone();
        this.health = health;
        this.maxHealth = maxHealth;
        this.kills = kills;
        this.deaths = deaths;
        this.missiles = missiles;
        this.maxMissiles = maxMissiles;
        this.laserUpgrade = laserUpgrade;
        this.alive = alive;
        this.lastAckedInputSeq = lastAckedInputSeq;
        this.boostFuel = boostFuel;
        this.boosting = boosting;
    }

    public static PlayerState of(PlayerEntity p) {
        return new PlayerState(p.id, p.name, p.shipClass.name(),
                Vectors.toArray(p.position), Vectors.toArray(p.rotation), Vectors.toArray(p.velocity),
                p.health, p.maxHealth, p.kills, p.deaths, p.missiles, p.maxMissiles,
                p.laserUpgrade, p.alive, p.lastAckedInputSeq, p.boost.getFuel(), p.boost.isBoosting());
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getShipClass() {
        return shipClass;
    }

    public double[] getPosition() {
        return position.clone();
    }

    public double[] getRotation() {
        return rotation.clone();
    }

    public double[] getVelocity() {
        return velocity.clone();
    }

    public double getHealth() {
        return health;
    }

    public double getMaxHealth() {
        return maxHealth;
    }

    public int getKills() {
        return kills;
    }

    public int getDeaths() {
        return deaths;
    }

    public int getMissiles() {
        return missiles;
    }

    public int getMaxMissiles() {
        return maxMissiles;
    }

    public boolean isLaserUpgrade() {
        return laserUpgrade;
    }

    public boolean isAlive() {
        return alive;
    }

    public long getLastAckedInputSeq() {
        return lastAckedInputSeq;
    }

    public double getBoostFuel() {
        return boostFuel;
    }

    public boolean isBoosting() {
        return boosting;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlayerState)) return false;
        PlayerState that = (PlayerState) o;
        return Double.compare(that.health, health) == 0
                && Double.compare(that.maxHealth, maxHealth) == 0
                && kills == that.kills
                && deaths == that.deaths
                && missiles == that.missiles
                && maxMissiles == that.maxMissiles
                && laserUpgrade == that.laserUpgrade
                && alive == that.alive
                && lastAckedInputSeq == that.lastAckedInputSeq
                && Double.compare(that.boostFuel, boostFuel) == 0
                && boosting == that.boosting
                && id.equals(that.id)
                && Objects.equals(name, that.name)
                && Objects.equals(shipClass, that.shipClass)
                && Arrays.equals(position, that.position)
                && Arrays.equals(rotation, that.rotation)
                && Arrays.equals(velocity, that.velocity);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, name, shipClass, health, maxHealth, kills, deaths,
                missiles, maxMissiles, laserUpgrade, alive, lastAckedInputSeq, boostFuel, boosting);
        result = 31 * result + Arrays.hashCode(position);
        result = 31 * result + Arrays.hashCode(rotation);
        result = 31 * result + Arrays.hashCode(velocity);
        return result;
    }

    @Override
    public String toString() {
        return "PlayerState{" + id + " pos=" + Arrays.toString(position)
                + " hp=" + health + "/" + maxHealth + " alive=" + alive + "}";
    }
}
