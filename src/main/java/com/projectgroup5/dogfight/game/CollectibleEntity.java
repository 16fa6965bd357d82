package com.projectgroup5.dogfight.game;

import javax.vecmath.Point3d;

/**
 * 道具槽位：关卡加载时创建，之后只在激活/冷却之间切换，从不销毁
 */
public class CollectibleEntity {
    public final String id;
    public final CollectibleType type;
    public final Point3d position;

    public boolean active = true;
    // 仅在 active=false 时有效
    public double respawnRemaining;

    public CollectibleEntity(String id, CollectibleType type, Point3d position) {
        this.id = id;
        this.type = type;
        this.position = new Point3d(position);
    }
}
