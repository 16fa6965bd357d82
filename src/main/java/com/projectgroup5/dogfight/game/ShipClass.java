package com.projectgroup5.dogfight.game;

import java.util.Locale;

/**
 * 机型参数：生命、导弹数、加速度（单位/秒²）、最大速度（单位/秒）、加力燃料容量
 */
public enum ShipClass {
    FIGHTER(100, 6, 90.0, 135.0, 200.0),
    TANK(150, 4, 70.0, 110.0, 200.0),
    ROGUE(75, 8, 110.0, 160.0, 200.0);

    private final int maxHealth;
    private final int maxMissiles;
    private final double acceleration;
    private final double maxSpeed;
    private final double maxBoostFuel;

    ShipClass(int maxHealth, int maxMissiles, double acceleration, double maxSpeed, double maxBoostFuel) {
        this.maxHealth = maxHealth;
        this.maxMissiles = maxMissiles;
        this.acceleration = acceleration;
        this.maxSpeed = maxSpeed;
        this.maxBoostFuel = maxBoostFuel;
    }

    public int getMaxHealth() {
        return maxHealth;
    }

    public int getMaxMissiles() {
        return maxMissiles;
    }

    public double getAcceleration() {
        return acceleration;
    }

    public double getMaxSpeed() {
        return maxSpeed;
    }

    public double getMaxBoostFuel() {
        return maxBoostFuel;
    }

    /** 未知或缺省时按 FIGHTER 处理 */
    public static ShipClass fromWire(String value) {
        if (value == null || value.isBlank()) {
            return FIGHTER;
        }
        try {
            return ShipClass.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FIGHTER;
        }
    }
}
