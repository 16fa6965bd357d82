package com.projectgroup5.dogfight.replication;

import com.projectgroup5.dogfight.protocol.ServerMessage;

/**
 * 一个客户端连接的出站通道
 * send 只负责入队，不能阻塞调用方（tick 线程）
 */
public interface ConnectionSink {

    String getConnectionId();

    void send(ServerMessage message);

    void close(String reason);
}
