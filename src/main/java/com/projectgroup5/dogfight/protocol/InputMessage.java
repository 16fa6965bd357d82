package com.projectgroup5.dogfight.protocol;

/**
 * 移动输入：客户端物理模拟的结果 + 序号
 * 服务器只做边界检查后存储并广播
 */
public class InputMessage extends ClientMessage {
    private long seq;
    private double[] position;
    private double[] rotation;
    private double[] velocity;
    // 这一帧客户端是否在加力
    private boolean boost;

    public InputMessage() {
    }

    public InputMessage(long seq, double[] position, double[] rotation, double[] velocity) {
        this.seq = seq;
        this.position = position;
        this.rotation = rotation;
        this.velocity = velocity;
    }

    @Override
    public ClientMessageType getMessageType() {
        return ClientMessageType.INPUT;
    }

    @Override
    public void validate() {
        if (seq <= 0) {
            throw new ValidationException("seq must be positive");
        }
        requireVector("position", position, 3);
        requireVector("rotation", rotation, 4);
        requireVector("velocity", velocity, 3);
    }

    public long getSeq() {
        return seq;
    }

    public void setSeq(long seq) {
        this.seq = seq;
    }

    public double[] getPosition() {
        return position;
    }

    public void setPosition(double[] position) {
        this.position = position;
    }

    public double[] getRotation() {
        return rotation;
    }

    public void setRotation(double[] rotation) {
        this.rotation = rotation;
    }

    public double[] getVelocity() {
        return velocity;
    }

    public void setVelocity(double[] velocity) {
        this.velocity = velocity;
    }

    public boolean isBoost() {
        return boost;
    }

    public void setBoost(boolean boost) {
        this.boost = boost;
    }
}
