package com.projectgroup5.dogfight.client;

import com.projectgroup5.dogfight.protocol.AckMessage;
import com.projectgroup5.dogfight.protocol.ClientMessage;
import com.projectgroup5.dogfight.protocol.ResyncRequestMessage;
import com.projectgroup5.dogfight.protocol.SnapshotDecodeException;
import com.projectgroup5.dogfight.replication.DeltaCodec;
import com.projectgroup5.dogfight.replication.SnapshotHistory;
import com.projectgroup5.dogfight.replication.StateDelta;
import com.projectgroup5.dogfight.replication.WorldSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * 客户端的世界镜像
 * 把增量应用到对应的基线上，每应用一个 tick 回一个 ack；
 * 解码失败时发 resync 并继续使用最后一个完好的快照，直到收到全量
 */
public class ClientStateMirror {
    private static final Logger logger = LoggerFactory.getLogger(ClientStateMirror.class);

    private final SnapshotHistory history;
    private final Consumer<ClientMessage> outbound;

    private WorldSnapshot current;
    private long lastAppliedTick = -1;
    private boolean awaitingResync;

    public ClientStateMirror(int historySize, Consumer<ClientMessage> outbound) {
        this.history = new SnapshotHistory(historySize);
        this.outbound = outbound;
    }

    /**
     * @return 新应用的快照；过期、重复或解码失败时返回 null
     */
    public WorldSnapshot applyState(StateDelta delta) {
        if (delta.getTick() <= lastAppliedTick) {
            logger.debug("Ignoring state for tick {}, already at {}", delta.getTick(), lastAppliedTick);
            return null;
        }
        if (awaitingResync && !delta.isFull()) {
            return null;
        }
        WorldSnapshot base = delta.isFull() ? null : history.get(delta.getBaseTick());
        WorldSnapshot snapshot;
        try {
            snapshot = DeltaCodec.apply(base, delta);
        } catch (SnapshotDecodeException e) {
            requestResync(e.getMessage());
            return null;
        }
        history.put(snapshot);
        current = snapshot;
        lastAppliedTick = snapshot.getTick();
        awaitingResync = false;
        outbound.accept(new AckMessage(snapshot.getTick()));
        return snapshot;
    }

    public void requestResync(String reason) {
        if (awaitingResync) {
            return;
        }
        awaitingResync = true;
        logger.warn("Snapshot decode failed at tick {}: {}, requesting resync", lastAppliedTick, reason);
        outbound.accept(new ResyncRequestMessage(reason));
    }

    public WorldSnapshot getCurrent() {
        return current;
    }

    public long getLastAppliedTick() {
        return lastAppliedTick;
    }

    public boolean isAwaitingResync() {
        return awaitingResync;
    }
}
