package com.projectgroup5.dogfight.physics;

import javax.vecmath.Point3d;

public class SphereCollider {
    private final String id;
    private final Point3d center;
    private final double radius;

    public SphereCollider(String id, Point3d center, double radius) {
        this.id = id;
        this.center = center;
        this.radius = radius;
    }

    public String getId() {
        return id;
    }

    public Point3d getCenter() {
        return center;
    }

    public double getRadius() {
        return radius;
    }
}
