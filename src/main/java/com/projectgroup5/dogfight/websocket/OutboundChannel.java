package com.projectgroup5.dogfight.websocket;

import com.projectgroup5.dogfight.protocol.MessageCodec;
import com.projectgroup5.dogfight.protocol.ServerMessage;
import com.projectgroup5.dogfight.replication.ConnectionSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 单个 WebSocket 连接的出站队列
 * tick 线程只负责入队；发送在 outbound 线程池上进行，慢客户端只会堆积自己的队列，
 * 队列满了直接丢弃新消息（客户端靠 ack 基线和 resync 自行恢复）
 */
public class OutboundChannel implements ConnectionSink {
    private static final Logger logger = LoggerFactory.getLogger(OutboundChannel.class);

    private final WebSocketSession session;
    private final MessageCodec codec;
    private final TaskExecutor executor;
    private final int queueLimit;

    private final Queue<ServerMessage> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger queued = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    private volatile String closeReason;
    private volatile boolean sessionClosed;

    public OutboundChannel(WebSocketSession session, MessageCodec codec, TaskExecutor executor,
                           int sendTimeLimitMillis, int sendBufferSizeLimit, int queueLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, sendBufferSizeLimit,
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.DROP);
        this.codec = codec;
        this.executor = executor;
        this.queueLimit = queueLimit;
    }

    @Override
    public String getConnectionId() {
        return session.getId();
    }

    @Override
    public void send(ServerMessage message) {
        if (closeReason != null) {
            return;
        }
        if (queued.incrementAndGet() > queueLimit) {
            queued.decrementAndGet();
            long total = dropped.incrementAndGet();
            if (total == 1 || total % 100 == 0) {
                logger.warn("Outbound queue full for {}, dropped {} messages so far", getConnectionId(), total);
            }
            return;
        }
        queue.add(message);
        scheduleDrain();
    }

    /** 先把已入队的消息发完再关闭 */
    @Override
    public void close(String reason) {
        if (closeReason != null) {
            return;
        }
        closeReason = reason == null ? "closed" : reason;
        scheduleDrain();
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            ServerMessage message;
            while ((message = queue.poll()) != null) {
                queued.decrementAndGet();
                if (!write(message)) {
                    queue.clear();
                    queued.set(0);
                    break;
                }
            }
            if (closeReason != null && !sessionClosed) {
                closeSession(closeReason);
            }
        } finally {
            draining.set(false);
        }
        if (!queue.isEmpty() || (closeReason != null && !sessionClosed)) {
            scheduleDrain();
        }
    }

    private boolean write(ServerMessage message) {
        if (sessionClosed || !session.isOpen()) {
            return false;
        }
        try {
            session.sendMessage(new TextMessage(codec.encode(message)));
            return true;
        } catch (IOException e) {
            logger.warn("Send to {} failed: {}", getConnectionId(), e.getMessage());
            closeSession("send failed");
            return false;
        }
    }

    private void closeSession(String reason) {
        sessionClosed = true;
        if (closeReason == null) {
            closeReason = reason;
        }
        try {
            if (session.isOpen()) {
                session.close(CloseStatus.GOING_AWAY.withReason(reason));
            }
        } catch (IOException e) {
            logger.warn("Closing {} failed: {}", getConnectionId(), e.getMessage());
        }
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public int getQueuedCount() {
        return queued.get();
    }
}
