package com.projectgroup5.dogfight.replication;

import com.projectgroup5.dogfight.game.GameWorld;
import com.projectgroup5.dogfight.protocol.ServerMessage;
import com.projectgroup5.dogfight.protocol.StateMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 状态复制（每个房间一个）
 * 每 tick 结束后对每个连接，以它最后确认的 tick 为基线发送增量；基线不在历史里就发全量
 * replicate 只在 tick 线程调用，ack / resync / 注册可以来自任意 socket 线程
 */
public class StateReplicator {
    private static final Logger logger = LoggerFactory.getLogger(StateReplicator.class);

    private static final long NO_BASELINE = -1L;

    private final long roomId;
    private final SnapshotHistory history;
    private final Map<String, ConnectionState> connections = new ConcurrentHashMap<>();

    private volatile WorldSnapshot latest;

    public StateReplicator(long roomId, int historySize) {
        this.roomId = roomId;
        this.history = new SnapshotHistory(historySize);
    }

    public void register(ConnectionSink sink) {
        connections.put(sink.getConnectionId(), new ConnectionState(sink));
        logger.debug("Room {} replicating to connection {}", roomId, sink.getConnectionId());
    }

    /** @return 被移除的连接，不存在时为 null */
    public ConnectionSink unregister(String connectionId) {
        ConnectionState removed = connections.remove(connectionId);
        return removed == null ? null : removed.sink;
    }

    /** 客户端确认已应用 tick，基线只会前进 */
    public void acknowledge(String connectionId, long tick) {
        ConnectionState state = connections.get(connectionId);
        if (state == null) {
            return;
        }
        state.ackedTick.accumulateAndGet(tick, Math::max);
    }

    /** 客户端解码失败，丢弃基线，下一 tick 发全量 */
    public void requestResync(String connectionId) {
        ConnectionState state = connections.get(connectionId);
        if (state != null) {
            state.ackedTick.set(NO_BASELINE);
            logger.info("Room {} connection {} requested resync", roomId, connectionId);
        }
    }

    public void replicate(GameWorld world) {
        WorldSnapshot snapshot = WorldSnapshot.capture(world);
        history.put(snapshot);
        latest = snapshot;
        List<ServerMessage> events = world.drainEvents();

        // 同一基线的连接共用一份增量
        Map<Long, StateMessage> byBaseline = new HashMap<>();
        for (ConnectionState state : connections.values()) {
            long acked = state.ackedTick.get();
            WorldSnapshot base = acked >= 0 ? history.get(acked) : null;
            long key = base == null ? NO_BASELINE : acked;
            StateMessage message = byBaseline.computeIfAbsent(key,
                    k -> new StateMessage(DeltaCodec.diff(base, snapshot)));
            state.sink.send(message);
            for (ServerMessage event : events) {
                state.sink.send(event);
            }
        }
        logger.debug("Room {} replicated tick {} to {} connections ({} events)",
                roomId, snapshot.getTick(), connections.size(), events.size());
    }

    /** 直接发给房间内所有连接，不经过快照（例如房间关闭通知） */
    public void broadcast(ServerMessage message) {
        for (ConnectionState state : connections.values()) {
            state.sink.send(message);
        }
    }

    public void closeAll(String reason) {
        for (ConnectionState state : connections.values()) {
            state.sink.close(reason);
        }
        connections.clear();
    }

    public WorldSnapshot getLatestSnapshot() {
        return latest;
    }

    public int getConnectionCount() {
        return connections.size();
    }

    long getAckedTick(String connectionId) {
        ConnectionState state = connections.get(connectionId);
        return state == null ? NO_BASELINE : state.ackedTick.get();
    }

    private static final class ConnectionState {
        final ConnectionSink sink;
        final AtomicLong ackedTick = new AtomicLong(NO_BASELINE);

        ConnectionState(ConnectionSink sink) {
            this.sink = sink;
        }
    }
}
