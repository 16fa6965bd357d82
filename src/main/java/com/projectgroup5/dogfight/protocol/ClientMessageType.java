package com.projectgroup5.dogfight.protocol;

/**
 * Client → Server 消息类型
 */
public enum ClientMessageType {
    JOIN,
    INPUT,
    FIRE,
    MISSILE_UPDATE,
    CHAT,
    ACK,
    RESYNC,
    PING,
    LEAVE
}
