package com.projectgroup5.dogfight.protocol;

import com.projectgroup5.dogfight.game.Weapon;

/**
 * 开火：weapon = "laser" | "missile"
 * 导弹需要客户端自选的 clientId，服务器据此生成导弹 id（ownerId:m{clientId}）
 */
public class FireMessage extends ClientMessage {
    private String weapon;
    private double[] position;
    private double[] direction;
    private Integer clientId;

    public FireMessage() {
    }

    public FireMessage(String weapon, double[] position, double[] direction) {
        this.weapon = weapon;
        this.position = position;
        this.direction = direction;
    }

    @Override
    public ClientMessageType getMessageType() {
        return ClientMessageType.FIRE;
    }

    @Override
    public void validate() {
        Weapon parsed = Weapon.fromWire(weapon);
        requireVector("position", position, 3);
        requireVector("direction", direction, 3);
        if (parsed == Weapon.MISSILE && (clientId == null || clientId < 0)) {
            throw new ValidationException("missile fire needs a non-negative clientId");
        }
    }

    public String getWeapon() {
        return weapon;
    }

    public void setWeapon(String weapon) {
        this.weapon = weapon;
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

    public Integer getClientId() {
        return clientId;
    }

    public void setClientId(Integer clientId) {
        this.clientId = clientId;
    }
}
