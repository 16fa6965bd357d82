package com.projectgroup5.dogfight.game;

/**
 * 加力燃料
 * 服务器的 PlayerEntity 和客户端预测各持有一份，按同一套规则（ShipMotionModel.updateBoost）更新
 */
public class BoostTank {
    private final double capacity;
    private double fuel;
    // 模拟时间（秒）
    private double lastBoostTime = Double.NEGATIVE_INFINITY;
    private boolean boosting;

    public BoostTank(double capacity) {
        this.capacity = capacity;
        this.fuel = capacity;
    }

    public void refill() {
        fuel = capacity;
        lastBoostTime = Double.NEGATIVE_INFINITY;
        boosting = false;
    }

    public double getCapacity() {
        return capacity;
    }

    public double getFuel() {
        return fuel;
    }

    void setFuel(double fuel) {
        this.fuel = fuel;
    }

    public double getLastBoostTime() {
        return lastBoostTime;
    }

    void setLastBoostTime(double lastBoostTime) {
        this.lastBoostTime = lastBoostTime;
    }

    public boolean isBoosting() {
        return boosting;
    }

    void setBoosting(boolean boosting) {
        this.boosting = boosting;
    }
}
