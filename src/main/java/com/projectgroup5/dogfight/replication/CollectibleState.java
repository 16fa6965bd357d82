package com.projectgroup5.dogfight.replication;

import com.projectgroup5.dogfight.game.CollectibleEntity;
import com.projectgroup5.dogfight.game.Vectors;

import java.util.Arrays;
import java.util.Objects;

public final class CollectibleState {
    private final String id;
    private final String type;
    private final double[] position;
    private final boolean active;
    private final double respawnRemaining;

    public CollectibleState(String id, String type, double[] position, boolean active, double respawnRemaining) {
        this.id = id;
        this.type = type;
        this.position = position.clone();
        this.active = active;
        this.respawnRemaining = respawnRemaining;
    }

    public static CollectibleState of(CollectibleEntity c) {
        return new CollectibleState(c.id, c.type.name(), Vectors.toArray(c.position),
                c.active, c.active ? 0.0 : c.respawnRemaining);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public double[] getPosition() {
        return position.clone();
    }

    public boolean isActive() {
        return active;
    }

    public double getRespawnRemaining() {
        return respawnRemaining;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CollectibleState)) return false;
        CollectibleState that = (CollectibleState) o;
        return active == that.active
                && Double.compare(that.respawnRemaining, respawnRemaining) == 0
                && id.equals(that.id)
                && Objects.equals(type, that.type)
                && Arrays.equals(position, that.position);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, type, active, respawnRemaining);
        result = 31 * result + Arrays.hashCode(position);
        return result;
    }
}
