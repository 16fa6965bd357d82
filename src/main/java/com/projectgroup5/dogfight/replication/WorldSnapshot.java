package com.projectgroup5.dogfight.replication;

import com.projectgroup5.dogfight.game.CollectibleEntity;
import com.projectgroup5.dogfight.game.GameWorld;
import com.projectgroup5.dogfight.game.PlayerEntity;
import com.projectgroup5.dogfight.game.ProjectileEntity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 某个 tick 结束时整个世界的不可变快照，增量计算的基线
 */
public final class WorldSnapshot {
    private final long tick;
    private final String phase;
    private final double phaseTimer;
    private final Map<String, PlayerState> players;
    private final Map<String, ProjectileState> projectiles;
    private final Map<String, CollectibleState> collectibles;

    public WorldSnapshot(long tick, String phase, double phaseTimer,
                         Map<String, PlayerState> players,
                         Map<String, ProjectileState> projectiles,
                         Map<String, CollectibleState> collectibles) {
        this.tick = tick;
        this.phase = phase;
        this.phaseTimer = phaseTimer;
        this.players = Collections.unmodifiableMap(new LinkedHashMap<>(players));
        this.projectiles = Collections.unmodifiableMap(new LinkedHashMap<>(projectiles));
        this.collectibles = Collections.unmodifiableMap(new LinkedHashMap<>(collectibles));
    }

    public static WorldSnapshot capture(GameWorld world) {
        Map<String, PlayerState> players = new LinkedHashMap<>();
        for (PlayerEntity p : world.getPlayers().values()) {
            players.put(p.id, PlayerState.of(p));
        }
        Map<String, ProjectileState> projectiles = new LinkedHashMap<>();
        for (ProjectileEntity p : world.getProjectiles().values()) {
            projectiles.put(p.id, ProjectileState.of(p));
        }
        Map<String, CollectibleState> collectibles = new LinkedHashMap<>();
        for (CollectibleEntity c : world.getCollectibles().values()) {
            collectibles.put(c.id, CollectibleState.of(c));
        }
        return new WorldSnapshot(world.getTick(), world.getPhase().name(), world.getPhaseTimer(),
                players, projectiles, collectibles);
    }

    public long getTick() {
        return tick;
    }

    public String getPhase() {
        return phase;
    }

    public double getPhaseTimer() {
        return phaseTimer;
    }

    public Map<String, PlayerState> getPlayers() {
        return players;
    }

    public Map<String, ProjectileState> getProjectiles() {
        return projectiles;
    }

    public Map<String, CollectibleState> getCollectibles() {
        return collectibles;
    }

    /** tick 不参与比较：只比较世界内容 */
    public boolean sameContentAs(WorldSnapshot other) {
        return other != null
                && Objects.equals(phase, other.phase)
                && Double.compare(phaseTimer, other.phaseTimer) == 0
                && players.equals(other.players)
                && projectiles.equals(other.projectiles)
                && collectibles.equals(other.collectibles);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorldSnapshot)) return false;
        WorldSnapshot that = (WorldSnapshot) o;
        return tick == that.tick && sameContentAs(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tick, phase, phaseTimer, players, projectiles, collectibles);
    }
}
