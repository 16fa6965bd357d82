package com.projectgroup5.dogfight.game;

import com.projectgroup5.dogfight.protocol.ServerMessage;

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 游戏世界状态（服务器权威）
 * 单个房间的完整状态，只由该房间的 tick 线程读写；不同房间之间没有任何共享
 */
public class GameWorld {

    /** 计时器比较用的误差，避免累加 dt 后"恰好为 0"被判成正数 */
    public static final double TIMER_EPSILON = 1e-9;

    private final long roomId;
    private final LevelLayout level;
    private final double tickSeconds;

    private long tick = 0;
    private GamePhase phase = GamePhase.LOBBY;
    private double phaseTimer = 0;
    private boolean restartRequested;

    // 插入顺序迭代，保证回放确定性
    private final Map<String, PlayerEntity> players = new LinkedHashMap<>();
    private final Map<String, ProjectileEntity> projectiles = new LinkedHashMap<>();
    private final Map<String, CollectibleEntity> collectibles = new LinkedHashMap<>();

    // 本 tick 产生的离散事件，复制器广播后清空
    private final List<ServerMessage> pendingEvents = new ArrayList<>();

    private long projectileSeq = 0;
    private int spawnCursor = 0;
    private String hostPlayerId;

    public GameWorld(long roomId, LevelLayout level, double tickSeconds) {
        this.roomId = roomId;
        this.level = level;
        this.tickSeconds = tickSeconds;
        for (LevelLayout.CollectibleSlot slot : level.getCollectibleSlots()) {
            collectibles.put(slot.getId(),
                    new CollectibleEntity(slot.getId(), slot.getType(), slot.getPosition()));
        }
    }

    public long advanceTick() {
        return ++tick;
    }

    /** 模拟时间（秒），由 tick 计算得到而不是累加 */
    public double getSimTime() {
        return tick * tickSeconds;
    }

    public Point3d nextSpawnPoint() {
        List<Point3d> spawns = level.getPlayerSpawns();
        Point3d spawn = spawns.get(spawnCursor % spawns.size());
        spawnCursor++;
        return new Point3d(spawn);
    }

    public String nextProjectileId() {
        projectileSeq++;
        return "p" + projectileSeq;
    }

    public void emit(ServerMessage event) {
        pendingEvents.add(event);
    }

    public List<ServerMessage> drainEvents() {
        if (pendingEvents.isEmpty()) {
            return Collections.emptyList();
        }
        List<ServerMessage> drained = new ArrayList<>(pendingEvents);
        pendingEvents.clear();
        return drained;
    }

    public List<ServerMessage> getPendingEvents() {
        return Collections.unmodifiableList(pendingEvents);
    }

    // Getters / setters

    public long getRoomId() {
        return roomId;
    }

    public LevelLayout getLevel() {
        return level;
    }

    public double getTickSeconds() {
        return tickSeconds;
    }

    public long getTick() {
        return tick;
    }

    public GamePhase getPhase() {
        return phase;
    }

    public void setPhase(GamePhase phase) {
        this.phase = phase;
    }

    public double getPhaseTimer() {
        return phaseTimer;
    }

    public void setPhaseTimer(double phaseTimer) {
        this.phaseTimer = phaseTimer;
    }

    public boolean isRestartRequested() {
        return restartRequested;
    }

    public void setRestartRequested(boolean restartRequested) {
        this.restartRequested = restartRequested;
    }

    public Map<String, PlayerEntity> getPlayers() {
        return players;
    }

    public Map<String, ProjectileEntity> getProjectiles() {
        return projectiles;
    }

    public Map<String, CollectibleEntity> getCollectibles() {
        return collectibles;
    }

    public String getHostPlayerId() {
        return hostPlayerId;
    }

    public void setHostPlayerId(String hostPlayerId) {
        this.hostPlayerId = hostPlayerId;
    }
}
