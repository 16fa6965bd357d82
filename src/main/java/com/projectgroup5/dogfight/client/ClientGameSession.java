package com.projectgroup5.dogfight.client;

import com.projectgroup5.dogfight.config.GameProperties;
import com.projectgroup5.dogfight.game.ShipClass;
import com.projectgroup5.dogfight.game.ShipMotionModel;
import com.projectgroup5.dogfight.game.Vectors;
import com.projectgroup5.dogfight.protocol.ClientMessage;
import com.projectgroup5.dogfight.protocol.InputMessage;
import com.projectgroup5.dogfight.protocol.MessageCodec;
import com.projectgroup5.dogfight.protocol.RespawnMessage;
import com.projectgroup5.dogfight.protocol.ServerMessage;
import com.projectgroup5.dogfight.protocol.SnapshotDecodeException;
import com.projectgroup5.dogfight.protocol.StateMessage;
import com.projectgroup5.dogfight.replication.PlayerState;
import com.projectgroup5.dogfight.replication.WorldSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * 客户端会话：解码服务器消息，维护世界镜像，驱动本地飞船的预测和校正
 * 渲染、音效等表现层通过 eventListener 接收离散事件
 */
public class ClientGameSession {
    private static final Logger logger = LoggerFactory.getLogger(ClientGameSession.class);

    private final String localPlayerId;
    private final MessageCodec codec;
    private final Consumer<String> transport;
    private final Consumer<ServerMessage> eventListener;
    private final LongSupplier clockMillis;

    private final ClientStateMirror mirror;
    private final Reconciler reconciler;
    // 第一次在快照里看到本地飞船时直接对齐到出生点
    private boolean localPlaced;

    public ClientGameSession(String localPlayerId, ShipClass shipClass, double arenaHalfExtent,
                             GameProperties properties, MessageCodec codec,
                             Consumer<String> transport, Consumer<ServerMessage> eventListener,
                             LongSupplier clockMillis) {
        this.localPlayerId = localPlayerId;
        this.codec = codec;
        this.transport = transport;
        this.eventListener = eventListener;
        this.clockMillis = clockMillis;
        this.mirror = new ClientStateMirror(properties.getSimulation().getSnapshotHistory(), this::send);
        GameProperties.Reconciliation reconciliation = properties.getReconciliation();
        ShipMotionModel motionModel = new ShipMotionModel(properties.getMovement(), arenaHalfExtent);
        ClientPredictor predictor = new ClientPredictor(shipClass, motionModel, reconciliation.getHistorySize());
        this.reconciler = new Reconciler(predictor, reconciliation.getThreshold(), reconciliation.getBlendMillis());
    }

    /** 一帧本地输入：立即预测并发送 */
    public InputMessage control(ControlInput input, double dt) {
        InputMessage message = reconciler.applyInput(input, dt);
        send(message);
        return message;
    }

    public void onServerText(String json) {
        ServerMessage message;
        try {
            message = codec.decodeServer(json);
        } catch (SnapshotDecodeException e) {
            mirror.requestResync(e.getMessage());
            return;
        }
        onServerMessage(message);
    }

    public void onServerMessage(ServerMessage message) {
        if (message instanceof StateMessage) {
            WorldSnapshot snapshot = mirror.applyState(((StateMessage) message).getDelta());
            if (snapshot != null) {
                reconcileLocalPlayer(snapshot);
            }
            return;
        }
        if (message instanceof RespawnMessage) {
            RespawnMessage respawn = (RespawnMessage) message;
            if (localPlayerId.equals(respawn.getPlayerId())) {
                reconciler.reset(Vectors.point(respawn.getPosition()), Vectors.identity(), new Vector3d());
                reconciler.getPredictor().refillBoost();
                localPlaced = true;
                logger.debug("Local player respawned at tick {}", respawn.getTick());
            }
        }
        eventListener.accept(message);
    }

    private void reconcileLocalPlayer(WorldSnapshot snapshot) {
        PlayerState local = snapshot.getPlayers().get(localPlayerId);
        if (local == null || !local.isAlive()) {
            return;
        }
        if (!localPlaced) {
            reconciler.reset(Vectors.point(local.getPosition()), Vectors.quat(local.getRotation()),
                    Vectors.vector(local.getVelocity()));
            localPlaced = true;
            return;
        }
        reconciler.onAuthoritativeState(snapshot.getTick(), local.getLastAckedInputSeq(),
                Vectors.point(local.getPosition()), clockMillis.getAsLong());
    }

    public Point3d renderedPosition() {
        long now = clockMillis.getAsLong();
        reconciler.update(now);
        return reconciler.renderedPosition(now);
    }

    private void send(ClientMessage message) {
        transport.accept(codec.encode(message));
    }

    public WorldSnapshot getWorld() {
        return mirror.getCurrent();
    }

    public ClientStateMirror getMirror() {
        return mirror;
    }

    public Reconciler getReconciler() {
        return reconciler;
    }
}
