package com.projectgroup5.dogfight.replication;

import com.projectgroup5.dogfight.game.ProjectileEntity;
import com.projectgroup5.dogfight.game.Vectors;

import java.util.Arrays;
import java.util.Objects;

public final class ProjectileState {
    private final String id;
    private final String ownerId;
    private final String weapon;
    private final double[] position;
    private final double[] direction;
    private final double speed;
    private final int damage;
    private final long spawnTick;
    private final boolean serverSimulated;

    public ProjectileState(String id, String ownerId, String weapon,
                           double[] position, double[] direction,
                           double speed, int damage, long spawnTick, boolean serverSimulated) {
        this.id = id;
        this.ownerId = ownerId;
        this.weapon = weapon;
        this.position = position.clone();
        this.direction = direction.clone();
        this.speed = speed;
        this.damage = damage;
        this.spawnTick = spawnTick;
        this.serverSimulated = serverSimulated;
    }

    public static ProjectileState of(ProjectileEntity p) {
        return new ProjectileState(p.id, p.ownerId, p.weapon.name(),
                Vectors.toArray(p.position), Vectors.toArray(p.direction),
                p.speed, p.damage, p.spawnTick, p.serverSimulated);
    }

    public String getId() {
        return id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getWeapon() {
        return weapon;
    }

    public double[] getPosition() {
        return position.clone();
    }

    public double[] getDirection() {
        return direction.clone();
    }

    public double getSpeed() {
        return speed;
    }

    public int getDamage() {
        return damage;
    }

    public long getSpawnTick() {
        return spawnTick;
    }

    public boolean isServerSimulated() {
        return serverSimulated;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectileState)) return false;
        ProjectileState that = (ProjectileState) o;
        return Double.compare(that.speed, speed) == 0
                && damage == that.damage
                && spawnTick == that.spawnTick
                && serverSimulated == that.serverSimulated
                && id.equals(that.id)
                && Objects.equals(ownerId, that.ownerId)
                && Objects.equals(weapon, that.weapon)
                && Arrays.equals(position, that.position)
                && Arrays.equals(direction, that.direction);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, ownerId, weapon, speed, damage, spawnTick, serverSimulated);
        result = 31 * result + Arrays.hashCode(position);
        result = 31 * result + Arrays.hashCode(direction);
        return result;
    }
}
