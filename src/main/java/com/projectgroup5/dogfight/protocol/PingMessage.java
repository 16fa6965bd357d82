package com.projectgroup5.dogfight.protocol;

/** 心跳 */
public class PingMessage extends ClientMessage {
    private long clientTime;

    public PingMessage() {
    }

    public PingMessage(long clientTime) {
        this.clientTime = clientTime;
    }

    @Override
    public ClientMessageType getMessageType() {
        return ClientMessageType.PING;
    }

    public long getClientTime() {
        return clientTime;
    }

    public void setClientTime(long clientTime) {
        this.clientTime = clientTime;
    }
}
