package com.projectgroup5.dogfight.game;

import com.projectgroup5.dogfight.config.GameProperties;
import com.projectgroup5.dogfight.game.system.CollectibleSpawner;
import com.projectgroup5.dogfight.game.system.CombatResolver;
import com.projectgroup5.dogfight.game.system.InputIngestor;
import com.projectgroup5.dogfight.game.system.PhaseController;
import com.projectgroup5.dogfight.game.system.ShieldRegenerator;
import com.projectgroup5.dogfight.identity.PlayerIdentity;
import com.projectgroup5.dogfight.protocol.AckMessage;
import com.projectgroup5.dogfight.protocol.ClientMessage;
import com.projectgroup5.dogfight.protocol.ErrorMessage;
import com.projectgroup5.dogfight.protocol.ServerMessage;
import com.projectgroup5.dogfight.replication.ConnectionSink;
import com.projectgroup5.dogfight.replication.StateReplicator;
import com.projectgroup5.dogfight.replication.WorldSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 一个对局房间：拥有自己的世界、时钟、输入队列和复制器
 * 世界只在 step() 里被修改，advance() 保证同一时刻只有一个线程在推进
 */
public class GameRoom {
    private static final Logger logger = LoggerFactory.getLogger(GameRoom.class);

    private final long roomId;
    private final GameProperties properties;
    private final GameWorld world;
    private final SimulationClock clock;
    private final InputIngestor ingestor;
    private final StateReplicator replicator;

    private final CombatResolver combatResolver;
    private final ShieldRegenerator shieldRegenerator;
    private final CollectibleSpawner collectibleSpawner;
    private final PhaseController phaseController;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean closed;
    private volatile long emptySinceMillis;
    private final AtomicInteger consecutiveFaults = new AtomicInteger();
    private long reportedDroppedSteps;

    public GameRoom(long roomId, LevelLayout level, GameProperties properties,
                    CombatResolver combatResolver, ShieldRegenerator shieldRegenerator,
                    CollectibleSpawner collectibleSpawner, PhaseController phaseController) {
        this.roomId = roomId;
        this.properties = properties;
        GameProperties.Simulation simulation = properties.getSimulation();
        this.world = new GameWorld(roomId, level, simulation.getTickSeconds());
        this.clock = new SimulationClock(simulation.getTickMillis() * 1_000_000L, simulation.getMaxCatchUpSteps());
        ShipMotionModel motionModel = new ShipMotionModel(properties.getMovement(), level.getArenaHalfExtent());
        this.ingestor = new InputIngestor(roomId, properties, motionModel);
        this.replicator = new StateReplicator(roomId, simulation.getSnapshotHistory());
        this.combatResolver = combatResolver;
        this.shieldRegenerator = shieldRegenerator;
        this.collectibleSpawner = collectibleSpawner;
        this.phaseController = phaseController;
        this.emptySinceMillis = System.currentTimeMillis();
    }

    // ==================== 连接 ====================

    public void attach(ConnectionSink sink, PlayerIdentity identity, ShipClass shipClass) {
        attach(sink, identity, shipClass, null);
    }

    /**
     * @param greeting 房间确认接收后、第一个 state 之前发出；房间已关闭时不会发出
     */
    public void attach(ConnectionSink sink, PlayerIdentity identity, ShipClass shipClass, ServerMessage greeting) {
        if (closed) {
            throw new IllegalStateException("Room " + roomId + " is closed");
        }
        if (greeting != null) {
            sink.send(greeting);
        }
        List<String> displaced = ingestor.connect(sink.getConnectionId(), identity, shipClass);
        for (String connectionId : displaced) {
            ConnectionSink old = replicator.unregister(connectionId);
            if (old != null) {
                old.close("replaced by a newer connection");
            }
        }
        replicator.register(sink);
        emptySinceMillis = 0;
    }

    public void detach(String connectionId) {
        ingestor.disconnect(connectionId);
        replicator.unregister(connectionId);
        if (replicator.getConnectionCount() == 0) {
            emptySinceMillis = System.currentTimeMillis();
        }
    }

    /** ack / resync 交给复制器，其余进入输入队列 */
    public boolean submit(String connectionId, ClientMessage message) {
        switch (message.getMessageType()) {
            case ACK -> {
                replicator.acknowledge(connectionId, ((AckMessage) message).getTick());
                return true;
            }
            case RESYNC -> {
                replicator.requestResync(connectionId);
                return true;
            }
            default -> {
                return ingestor.submit(connectionId, message);
            }
        }
    }

    public void requestRestart() {
        ingestor.requestRestart();
    }

    // ==================== 模拟 ====================

    /**
     * 按墙钟推进，跑完所有到期的固定步
     *
     * @return 本次运行的步数；另一个线程正在推进时返回 0
     */
    public int advance(long nowNanos) {
        if (closed || !running.compareAndSet(false, true)) {
            return 0;
        }
        try {
            int steps = clock.advance(nowNanos);
            long dropped = clock.getDroppedSteps();
            if (dropped > reportedDroppedSteps) {
                logger.warn("Room {} fell behind, dropped {} steps (total {})",
                        roomId, dropped - reportedDroppedSteps, dropped);
                reportedDroppedSteps = dropped;
            }
            for (int i = 0; i < steps; i++) {
                step();
            }
            consecutiveFaults.set(0);
            return steps;
        } finally {
            running.set(false);
        }
    }

    /** 一个固定步长的 tick，系统顺序固定 */
    public void step() {
        world.advanceTick();
        double dt = world.getTickSeconds();
        ingestor.applyPending(world);
        combatResolver.resolve(world, dt);
        shieldRegenerator.regenerate(world, dt);
        collectibleSpawner.update(world, dt);
        phaseController.update(world, dt);
        replicator.replicate(world);
    }

    /** @return 连续失败次数 */
    public int recordFault() {
        return consecutiveFaults.incrementAndGet();
    }

    public void shutdown(String reason) {
        if (closed) {
            return;
        }
        closed = true;
        replicator.broadcast(new ErrorMessage(reason));
        replicator.closeAll(reason);
        logger.info("Room {} shut down: {}", roomId, reason);
    }

    public boolean isIdle(long nowMillis) {
        long since = emptySinceMillis;
        return since > 0 && replicator.getConnectionCount() == 0
                && nowMillis - since >= properties.getSimulation().getEmptyRoomGraceMillis();
    }

    // ==================== 查询 ====================

    public long getRoomId() {
        return roomId;
    }

    public boolean isClosed() {
        return closed;
    }

    public int getTickRate() {
        return (int) Math.round(1000.0 / properties.getSimulation().getTickMillis());
    }

    public int getConnectionCount() {
        return replicator.getConnectionCount();
    }

    /** 最近一次复制的快照，供 REST 读取；还没有跑过 tick 时为 null */
    public WorldSnapshot getLatestSnapshot() {
        return replicator.getLatestSnapshot();
    }

    GameWorld getWorld() {
        return world;
    }

    InputIngestor getIngestor() {
        return ingestor;
    }

    StateReplicator getReplicator() {
        return replicator;
    }
}
