package com.projectgroup5.dogfight.protocol;

/**
 * 导弹所有者上报的位置/方向（只有所有者可以发）
 */
public class MissileUpdateMessage extends ClientMessage {
    private String id;
    private double[] position;
    private double[] direction;

    public MissileUpdateMessage() {
    }

    public MissileUpdateMessage(String id, double[] position, double[] direction) {
        this.id = id;
        this.position = position;
        this.direction = direction;
    }

    @Override
    public ClientMessageType getMessageType() {
        return ClientMessageType.MISSILE_UPDATE;
    }

    @Override
    public void validate() {
        if (id == null || id.isBlank()) {
            throw new ValidationException("missile id is missing");
        }
        requireVector("position", position, 3);
        requireVector("direction", direction, 3);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public double[] getPosition() {
        return position;
    }

    public void setPosition(double[] position) {
        this.position = position;
    }

    public double[] getDirection() {
        return direction;
    }

    public void setDirection(double[] direction) {
        this.direction = direction;
    }
}
