package com.projectgroup5.dogfight.physics;

import javax.vecmath.Point3d;
import java.util.List;
import java.util.Optional;

/**
 * 扫掠形状查询，碰撞判定只依赖这一个接口
 */
public interface SweptShapeQuery {

    /**
     * 半径为 radius 的球从 from 移动到 to，返回最先接触的碰撞体
     * 多个碰撞体接触距离相同时按列表顺序取第一个
     */
    Optional<SweepHit> castSphere(Point3d from, Point3d to, double radius, List<SphereCollider> colliders);
}
