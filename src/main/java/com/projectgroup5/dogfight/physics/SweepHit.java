package com.projectgroup5.dogfight.physics;

/**
 * 扫掠命中结果
 * distance 是从起点沿线段到接触点的距离，0 表示起点就已重叠
 */
public class SweepHit {
    private final String colliderId;
    private final double distance;

    public SweepHit(String colliderId, double distance) {
        this.colliderId = colliderId;
        this.distance = distance;
    }

    public String getColliderId() {
        return colliderId;
    }

    public double getDistance() {
        return distance;
    }

    @Override
    public String toString() {
        return "SweepHit{" + colliderId + " @ " + distance + "}";
    }
}
