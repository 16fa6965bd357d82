package com.projectgroup5.dogfight.websocket;

import com.projectgroup5.dogfight.config.GameProperties;
import com.projectgroup5.dogfight.game.GameRoom;
import com.projectgroup5.dogfight.game.GameRoomManager;
import com.projectgroup5.dogfight.game.ShipClass;
import com.projectgroup5.dogfight.identity.IdentityProvider;
import com.projectgroup5.dogfight.identity.PlayerIdentity;
import com.projectgroup5.dogfight.protocol.ClientMessage;
import com.projectgroup5.dogfight.protocol.ErrorMessage;
import com.projectgroup5.dogfight.protocol.JoinMessage;
import com.projectgroup5.dogfight.protocol.MessageCodec;
import com.projectgroup5.dogfight.protocol.ValidationException;
import com.projectgroup5.dogfight.protocol.WelcomeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket 核心处理器（服务器权威）
 * 只负责解析、校验和路由：join 进房间，其余消息交给房间的输入队列，
 * 世界状态从不在 socket 线程上修改
 */
@Component
public class GameWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(GameWebSocketHandler.class);

    private final GameRoomManager roomManager;
    private final MessageCodec codec;
    private final IdentityProvider identityProvider;
    private final GameProperties properties;
    private final TaskExecutor outboundExecutor;

    // sessionId -> 连接信息
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    public GameWebSocketHandler(GameRoomManager roomManager,
                                MessageCodec codec,
                                IdentityProvider identityProvider,
                                GameProperties properties,
                                @Qualifier("outboundExecutor") TaskExecutor outboundExecutor) {
        this.roomManager = roomManager;
        this.codec = codec;
        this.identityProvider = identityProvider;
        this.properties = properties;
        this.outboundExecutor = outboundExecutor;
    }

    // ==================== 连接建立 / 关闭 ====================

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        GameProperties.Network network = properties.getNetwork();
        OutboundChannel channel = new OutboundChannel(session, codec, outboundExecutor,
                network.getSendTimeLimitMillis(), network.getSendBufferSizeLimit(), network.getOutboundQueueLimit());
        connections.put(session.getId(), new Connection(session, channel, System.currentTimeMillis()));
        logger.info("WebSocket connected: {}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        cleanupConnection(session.getId());
        logger.info("WebSocket disconnected: {}, status: {}", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        logger.warn("Transport error on {}: {}", session.getId(), exception.getMessage());
        cleanupConnection(session.getId());
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    /** 断线等同于离开房间 */
    private void cleanupConnection(String sessionId) {
        Connection conn = connections.remove(sessionId);
        if (conn == null || conn.roomId == null) {
            return;
        }
        roomManager.getRoom(conn.roomId).ifPresent(room -> room.detach(sessionId));
        logger.info("Player {} left room {}", conn.playerId, conn.roomId);
    }

    // ==================== 消息分发 ====================

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        Connection conn = connections.get(session.getId());
        if (conn == null) {
            return;
        }
        conn.lastSeenMillis = System.currentTimeMillis();

        ClientMessage msg;
        try {
            msg = codec.decodeClient(message.getPayload());
        } catch (ValidationException e) {
            logger.warn("Malformed message from {}: {}", session.getId(), e.getMessage());
            conn.channel.send(new ErrorMessage(e.getMessage()));
            return;
        }

        switch (msg.getMessageType()) {
            case JOIN -> handleJoin(conn, (JoinMessage) msg);
            case PING -> {
                // 只用来刷新心跳
            }
            case LEAVE -> session.close(CloseStatus.NORMAL);
            default -> routeToRoom(conn, msg);
        }
    }

    private void handleJoin(Connection conn, JoinMessage join) {
        String sessionId = conn.session.getId();
        if (conn.roomId != null) {
            conn.channel.send(new ErrorMessage("already joined room " + conn.roomId));
            return;
        }
        PlayerIdentity identity;
        try {
            identity = identityProvider.resolve(join.getName(), join.getToken());
        } catch (ValidationException e) {
            logger.warn("Join rejected for {}: {}", sessionId, e.getMessage());
            conn.channel.send(new ErrorMessage(e.getMessage()));
            return;
        }

        GameRoom room = roomManager.getOrCreateRoom(join.getRoomId());
        try {
            WelcomeMessage welcome = new WelcomeMessage(identity.getId(), room.getRoomId(), room.getTickRate(),
                    identity.getReconnectToken());
            room.attach(conn.channel, identity, ShipClass.fromWire(join.getShipClass()), welcome);
        } catch (IllegalStateException e) {
            logger.warn("Join to room {} failed for {}: {}", join.getRoomId(), sessionId, e.getMessage());
            conn.channel.send(new ErrorMessage("room " + join.getRoomId() + " is not available"));
            return;
        }
        conn.roomId = room.getRoomId();
        conn.playerId = identity.getId();
        logger.info("Player {} ({}) joined room {} on {}", identity.getDisplayName(), identity.getId(),
                room.getRoomId(), sessionId);
    }

    private void routeToRoom(Connection conn, ClientMessage msg) {
        if (conn.roomId == null) {
            conn.channel.send(new ErrorMessage("join a room first"));
            return;
        }
        Optional<GameRoom> room = roomManager.getRoom(conn.roomId);
        if (room.isEmpty()) {
            conn.channel.send(new ErrorMessage("room " + conn.roomId + " is gone"));
            return;
        }
        room.get().submit(conn.session.getId(), msg);
    }

    // ==================== 心跳 ====================

    @Scheduled(fixedRate = 1000)
    public void sweepStaleConnections() {
        sweepStaleConnections(System.currentTimeMillis());
    }

    /** @return 被关闭的连接数 */
    int sweepStaleConnections(long nowMillis) {
        long timeout = properties.getNetwork().getHeartbeatTimeoutMillis();
        int closed = 0;
        for (Connection conn : connections.values()) {
            if (nowMillis - conn.lastSeenMillis <= timeout) {
                continue;
            }
            String sessionId = conn.session.getId();
            logger.info("Connection {} timed out after {} ms without messages", sessionId, nowMillis - conn.lastSeenMillis);
            cleanupConnection(sessionId);
            try {
                conn.session.close(CloseStatus.SESSION_NOT_RELIABLE);
            } catch (IOException e) {
                logger.warn("Closing stale connection {} failed: {}", sessionId, e.getMessage());
            }
            closed++;
        }
        return closed;
    }

    int getConnectionCount() {
        return connections.size();
    }

    /** 连接信息 */
    private static class Connection {
        final WebSocketSession session;
        final OutboundChannel channel;
        volatile long lastSeenMillis;
        volatile Long roomId;
        volatile String playerId;

        Connection(WebSocketSession session, OutboundChannel channel, long lastSeenMillis) {
            this.session = session;
            this.channel = channel;
            this.lastSeenMillis = lastSeenMillis;
        }
    }
}
