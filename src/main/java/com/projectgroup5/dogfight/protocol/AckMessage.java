package com.projectgroup5.dogfight.protocol;

/**
 * 客户端确认已应用到某个 tick 的快照，服务器以此作为增量基线
 */
public class AckMessage extends ClientMessage {
    private long tick;

    public AckMessage() {
    }

    public AckMessage(long tick) {
        this.tick = tick;
    }

    @Override
    public ClientMessageType getMessageType() {
        return ClientMessageType.ACK;
    }

    @Override
    public void validate() {
        if (tick < 0) {
            throw new ValidationException("tick must not be negative");
        }
    }

    public long getTick() {
        return tick;
    }

    public void setTick(long tick) {
        this.tick = tick;
    }
}
