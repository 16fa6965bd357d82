package com.projectgroup5.dogfight.physics;

import org.springframework.stereotype.Component;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.List;
import java.util.Optional;

/**
 * 解析法实现：移动球 vs 静止球 等价于 线段 vs 半径相加后的球
 */
@Component
public class AnalyticSweptShapeQuery implements SweptShapeQuery {

    private static final double EPSILON = 1e-12;

    @Override
    public Optional<SweepHit> castSphere(Point3d from, Point3d to, double radius, List<SphereCollider> colliders) {
        Vector3d segment = new Vector3d();
        segment.sub(to, from);
        double length = segment.length();

        SweepHit best = null;
        for (SphereCollider collider : colliders) {
            double t = timeOfImpact(from, segment, length, collider.getCenter(), collider.getRadius() + radius);
            if (t < 0) {
                continue;
            }
            double distance = t * length;
            // 严格小于：相同距离保留列表里靠前的
            if (best == null || distance < best.getDistance()) {
                best = new SweepHit(collider.getId(), distance);
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * @return 线段参数 t ∈ [0,1]，没有接触时返回 -1
     */
    private static double timeOfImpact(Point3d from, Vector3d segment, double length,
                                       Point3d center, double combinedRadius) {
        Vector3d offset = new Vector3d();
        offset.sub(from, center);
        double c = offset.lengthSquared() - combinedRadius * combinedRadius;
        if (c <= 0) {
            return 0;
        }
        if (length < EPSILON) {
            return -1;
        }

        double a = segment.lengthSquared();
        double b = offset.dot(segment);
        // 远离球心
        if (b > 0) {
            return -1;
        }
        double discriminant = b * b - a * c;
        if (discriminant < 0) {
            return -1;
        }
        double t = (-b - Math.sqrt(discriminant)) / a;
        return t <= 1.0 ? t : -1;
    }
}
