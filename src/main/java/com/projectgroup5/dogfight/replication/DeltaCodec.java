package com.projectgroup5.dogfight.replication;

import com.projectgroup5.dogfight.protocol.SnapshotDecodeException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 快照之间的字段级增量
 * diff 只写出变化的字段；apply 在基线快照上覆盖这些字段，结果与服务器快照一致
 */
public final class DeltaCodec {

    private DeltaCodec() {
    }

    /**
     * @param base 连接上次确认的快照；null 表示没有基线，生成全量
     */
    public static StateDelta diff(WorldSnapshot base, WorldSnapshot current) {
        StateDelta delta = new StateDelta();
        delta.setTick(current.getTick());
        delta.setFull(base == null);
        if (base != null) {
            delta.setBaseTick(base.getTick());
        }

        if (base == null || !Objects.equals(base.getPhase(), current.getPhase())) {
            delta.setPhase(current.getPhase());
        }
        if (base == null || Double.compare(base.getPhaseTimer(), current.getPhaseTimer()) != 0) {
            delta.setPhaseTimer(current.getPhaseTimer());
        }

        // 玩家
        List<PlayerDelta> players = new ArrayList<>();
        for (PlayerState now : current.getPlayers().values()) {
            PlayerState before = base == null ? null : base.getPlayers().get(now.getId());
            PlayerDelta d = diffPlayer(before, now);
            if (d != null) {
                players.add(d);
            }
        }
        delta.setPlayers(nullIfEmpty(players));
        if (base != null) {
            delta.setRemovedPlayers(nullIfEmpty(removedKeys(base.getPlayers(), current.getPlayers())));
        }

        // 弹体
        List<ProjectileDelta> projectiles = new ArrayList<>();
        for (ProjectileState now : current.getProjectiles().values()) {
            ProjectileState before = base == null ? null : base.getProjectiles().get(now.getId());
            ProjectileDelta d = diffProjectile(before, now);
            if (d != null) {
                projectiles.add(d);
            }
        }
        delta.setProjectiles(nullIfEmpty(projectiles));
        if (base != null) {
            delta.setRemovedProjectiles(nullIfEmpty(removedKeys(base.getProjectiles(), current.getProjectiles())));
        }

        // 道具
        List<CollectibleDelta> collectibles = new ArrayList<>();
        for (CollectibleState now : current.getCollectibles().values()) {
            CollectibleState before = base == null ? null : base.getCollectibles().get(now.getId());
            CollectibleDelta d = diffCollectible(before, now);
            if (d != null) {
                collectibles.add(d);
            }
        }
        delta.setCollectibles(nullIfEmpty(collectibles));
        if (base != null) {
            delta.setRemovedCollectibles(nullIfEmpty(removedKeys(base.getCollectibles(), current.getCollectibles())));
        }
        return delta;
    }

    /**
     * @param base 客户端在 delta.baseTick 时的快照；全量增量时可为 null
     */
    public static WorldSnapshot apply(WorldSnapshot base, StateDelta delta) throws SnapshotDecodeException {
        if (!delta.isFull()) {
            if (base == null) {
                throw new SnapshotDecodeException("delta for tick " + delta.getTick() + " has no baseline");
            }
            if (base.getTick() != delta.getBaseTick()) {
                throw new SnapshotDecodeException("delta expects base tick " + delta.getBaseTick()
                        + " but baseline is tick " + base.getTick());
            }
        }
        WorldSnapshot origin = delta.isFull() ? null : base;

        String phase = delta.getPhase() != null ? delta.getPhase() : origin == null ? null : origin.getPhase();
        if (phase == null) {
            throw new SnapshotDecodeException("full snapshot for tick " + delta.getTick() + " has no phase");
        }
        double phaseTimer = delta.getPhaseTimer() != null ? delta.getPhaseTimer()
                : origin == null ? 0.0 : origin.getPhaseTimer();

        Map<String, PlayerState> players = origin == null
                ? new LinkedHashMap<>() : new LinkedHashMap<>(origin.getPlayers());
        removeAll(players, delta.getRemovedPlayers());
        if (delta.getPlayers() != null) {
            for (PlayerDelta d : delta.getPlayers()) {
                requireId(d.getId(), "player");
                players.put(d.getId(), applyPlayer(players.get(d.getId()), d));
            }
        }

        Map<String, ProjectileState> projectiles = origin == null
                ? new LinkedHashMap<>() : new LinkedHashMap<>(origin.getProjectiles());
        removeAll(projectiles, delta.getRemovedProjectiles());
        if (delta.getProjectiles() != null) {
            for (ProjectileDelta d : delta.getProjectiles()) {
                requireId(d.getId(), "projectile");
                projectiles.put(d.getId(), applyProjectile(projectiles.get(d.getId()), d));
            }
        }

        Map<String, CollectibleState> collectibles = origin == null
                ? new LinkedHashMap<>() : new LinkedHashMap<>(origin.getCollectibles());
        removeAll(collectibles, delta.getRemovedCollectibles());
        if (delta.getCollectibles() != null) {
            for (CollectibleDelta d : delta.getCollectibles()) {
                requireId(d.getId(), "collectible");
                collectibles.put(d.getId(), applyCollectible(collectibles.get(d.getId()), d));
            }
        }

        return new WorldSnapshot(delta.getTick(), phase, phaseTimer, players, projectiles, collectibles);
    }

    // ==================== 玩家 ====================

    static PlayerDelta diffPlayer(PlayerState before, PlayerState now) {
        PlayerDelta d = new PlayerDelta(now.getId());
        boolean changed = before == null;
        if (before == null || !Objects.equals(before.getName(), now.getName())) {
            d.setName(now.getName());
            changed = true;
        }
        if (before == null || !Objects.equals(before.getShipClass(), now.getShipClass())) {
            d.setShipClass(now.getShipClass());
            changed = true;
        }
        if (before == null || !Arrays.equals(before.getPosition(), now.getPosition())) {
            d.setPosition(now.getPosition());
            changed = true;
        }
        if (before == null || !Arrays.equals(before.getRotation(), now.getRotation())) {
            d.setRotation(now.getRotation());
            changed = true;
        }
        if (before == null || !Arrays.equals(before.getVelocity(), now.getVelocity())) {
            d.setVelocity(now.getVelocity());
            changed = true;
        }
        if (before == null || Double.compare(before.getHealth(), now.getHealth()) != 0) {
            d.setHealth(now.getHealth());
            changed = true;
        }
        if (before == null || Double.compare(before.getMaxHealth(), now.getMaxHealth()) != 0) {
            d.setMaxHealth(now.getMaxHealth());
            changed = true;
        }
        if (before == null || before.getKills() != now.getKills()) {
            d.setKills(now.getKills());
            changed = true;
        }
        if (before == null || before.getDeaths() != now.getDeaths()) {
            d.setDeaths(now.getDeaths());
            changed = true;
        }
        if (before == null || before.getMissiles() != now.getMissiles()) {
            d.setMissiles(now.getMissiles());
            changed = true;
        }
        if (before == null || before.getMaxMissiles() != now.getMaxMissiles()) {
            d.setMaxMissiles(now.getMaxMissiles());
            changed = true;
        }
        if (before == null || before.isLaserUpgrade() != now.isLaserUpgrade()) {
            d.setLaserUpgrade(now.isLaserUpgrade());
            changed = true;
        }
        if (before == null || before.isAlive() != now.isAlive()) {
            d.setAlive(now.isAlive());
            changed = true;
        }
        if (before == null || before.getLastAckedInputSeq() != now.getLastAckedInputSeq()) {
            d.setLastAckedInputSeq(now.getLastAckedInputSeq());
            changed = true;
        }
        if (before == null || Double.compare(before.getBoostFuel(), now.getBoostFuel()) != 0) {
            d.setBoostFuel(now.getBoostFuel());
            changed = true;
        }
        if (before == null || before.isBoosting() != now.isBoosting()) {
            d.setBoosting(now.isBoosting());
            changed = true;
        }
        return changed ? d : null;
    }

    static PlayerState applyPlayer(PlayerState base, PlayerDelta d) throws SnapshotDecodeException {
        if (base == null && !isCompletePlayer(d)) {
            throw new SnapshotDecodeException("new player " + d.getId() + " is missing fields");
        }
        return new PlayerState(d.getId(),
                d.getName() != null ? d.getName() : base.getName(),
                d.getShipClass() != null ? d.getShipClass() : base.getShipClass(),
                vector(d.getPosition(), 3, base == null ? null : base.getPosition()),
                vector(d.getRotation(), 4, base == null ? null : base.getRotation()),
                vector(d.getVelocity(), 3, base == null ? null : base.getVelocity()),
                d.getHealth() != null ? d.getHealth() : base.getHealth(),
                d.getMaxHealth() != null ? d.getMaxHealth() : base.getMaxHealth(),
                d.getKills() != null ? d.getKills() : base.getKills(),
                d.getDeaths() != null ? d.getDeaths() : base.getDeaths(),
                d.getMissiles() != null ? d.getMissiles() : base.getMissiles(),
                d.getMaxMissiles() != null ? d.getMaxMissiles() : base.getMaxMissiles(),
                d.getLaserUpgrade() != null ? d.getLaserUpgrade() : base.isLaserUpgrade(),
                d.getAlive() != null ? d.getAlive() : base.isAlive(),
                d.getLastAckedInputSeq() != null ? d.getLastAckedInputSeq() : base.getLastAckedInputSeq(),
                d.getBoostFuel() != null ? d.getBoostFuel() : base.getBoostFuel(),
                d.getBoosting() != null ? d.getBoosting() : base.isBoosting());
    }

    private static boolean isCompletePlayer(PlayerDelta d) {
        return d.getName() != null && d.getShipClass() != null
                && d.getPosition() != null && d.getRotation() != null && d.getVelocity() != null
                && d.getHealth() != null && d.getMaxHealth() != null
                && d.getKills() != null && d.getDeaths() != null
                && d.getMissiles() != null && d.getMaxMissiles() != null
                && d.getLaserUpgrade() != null && d.getAlive() != null
                && d.getLastAckedInputSeq() != null
                && d.getBoostFuel() != null && d.getBoosting() != null;
    }

    // ==================== 弹体 ====================

    static ProjectileDelta diffProjectile(ProjectileState before, ProjectileState now) {
        ProjectileDelta d = new ProjectileDelta(now.getId());
        boolean changed = before == null;
        if (before == null) {
            // 这些字段创建后不再变化
            d.setOwnerId(now.getOwnerId());
            d.setWeapon(now.getWeapon());
            d.setSpeed(now.getSpeed());
            d.setDamage(now.getDamage());
            d.setSpawnTick(now.getSpawnTick());
            d.setServerSimulated(now.isServerSimulated());
        }
        if (before == null || !Arrays.equals(before.getPosition(), now.getPosition())) {
            d.setPosition(now.getPosition());
            changed = true;
        }
        if (before == null || !Arrays.equals(before.getDirection(), now.getDirection())) {
            d.setDirection(now.getDirection());
            changed = true;
        }
        return changed ? d : null;
    }

    static ProjectileState applyProjectile(ProjectileState base, ProjectileDelta d) throws SnapshotDecodeException {
        if (base == null && (d.getOwnerId() == null || d.getWeapon() == null || d.getPosition() == null
                || d.getDirection() == null || d.getSpeed() == null || d.getDamage() == null
                || d.getSpawnTick() == null || d.getServerSimulated() == null)) {
            throw new SnapshotDecodeException("new projectile " + d.getId() + " is missing fields");
        }
        return new ProjectileState(d.getId(),
                d.getOwnerId() != null ? d.getOwnerId() : base.getOwnerId(),
                d.getWeapon() != null ? d.getWeapon() : base.getWeapon(),
                vector(d.getPosition(), 3, base == null ? null : base.getPosition()),
                vector(d.getDirection(), 3, base == null ? null : base.getDirection()),
                d.getSpeed() != null ? d.getSpeed() : base.getSpeed(),
                d.getDamage() != null ? d.getDamage() : base.getDamage(),
                d.getSpawnTick() != null ? d.getSpawnTick() : base.getSpawnTick(),
                d.getServerSimulated() != null ? d.getServerSimulated() : base.isServerSimulated());
    }

    // ==================== 道具 ====================

    static CollectibleDelta diffCollectible(CollectibleState before, CollectibleState now) {
        CollectibleDelta d = new CollectibleDelta(now.getId());
        boolean changed = before == null;
        if (before == null) {
            d.setType(now.getType());
            d.setPosition(now.getPosition());
        }
        if (before == null || before.isActive() != now.isActive()) {
            d.setActive(now.isActive());
            changed = true;
        }
        if (before == null || Double.compare(before.getRespawnRemaining(), now.getRespawnRemaining()) != 0) {
            d.setRespawnRemaining(now.getRespawnRemaining());
            changed = true;
        }
        return changed ? d : null;
    }

    static CollectibleState applyCollectible(CollectibleState base, CollectibleDelta d) throws SnapshotDecodeException {
        if (base == null && (d.getType() == null || d.getPosition() == null
                || d.getActive() == null || d.getRespawnRemaining() == null)) {
            throw new SnapshotDecodeException("new collectible " + d.getId() + " is missing fields");
        }
        return new CollectibleState(d.getId(),
                d.getType() != null ? d.getType() : base.getType(),
                vector(d.getPosition(), 3, base == null ? null : base.getPosition()),
                d.getActive() != null ? d.getActive() : base.isActive(),
                d.getRespawnRemaining() != null ? d.getRespawnRemaining() : base.getRespawnRemaining());
    }

    // ==================== 工具方法 ====================

    private static double[] vector(double[] value, int length, double[] fallback) throws SnapshotDecodeException {
        double[] chosen = value != null ? value : fallback;
        if (chosen == null || chosen.length != length) {
            throw new SnapshotDecodeException("vector field must have " + length + " components");
        }
        return chosen;
    }

    private static void requireId(String id, String kind) throws SnapshotDecodeException {
        if (id == null) {
            throw new SnapshotDecodeException(kind + " delta without id");
        }
    }

    private static <T> List<String> removedKeys(Map<String, T> before, Map<String, T> now) {
        List<String> removed = new ArrayList<>();
        for (String id : before.keySet()) {
            if (!now.containsKey(id)) {
                removed.add(id);
            }
        }
        return removed;
    }

    private static <T> void removeAll(Map<String, T> map, List<String> ids) {
        if (ids != null) {
            for (String id : ids) {
                map.remove(id);
            }
        }
    }

    private static <T> List<T> nullIfEmpty(List<T> list) {
        return list.isEmpty() ? null : list;
    }
}
