package com.projectgroup5.dogfight.protocol;

/**
 * 客户端增量解析失败，请求下一帧发全量快照
 */
public class ResyncRequestMessage extends ClientMessage {
    private String reason;

    public ResyncRequestMessage() {
    }

    public ResyncRequestMessage(String reason) {
        this.reason = reason;
    }

    @Override
    public ClientMessageType getMessageType() {
        return ClientMessageType.RESYNC;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
