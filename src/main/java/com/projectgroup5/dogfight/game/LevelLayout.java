package com.projectgroup5.dogfight.game;

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 关卡静态数据（由场景/资源层提供）：玩家出生点、道具槽位、场地范围
 */
public class LevelLayout {

    private final String name;
    private final double arenaHalfExtent;
    private final List<Point3d> playerSpawns;
    private final List<CollectibleSlot> collectibleSlots;

    public LevelLayout(String name, double arenaHalfExtent,
                       List<Point3d> playerSpawns, List<CollectibleSlot> collectibleSlots) {
        if (playerSpawns.isEmpty()) {
            throw new IllegalArgumentException("Level " + name + " has no player spawn points");
        }
        this.name = name;
        this.arenaHalfExtent = arenaHalfExtent;
        this.playerSpawns = Collections.unmodifiableList(new ArrayList<>(playerSpawns));
        this.collectibleSlots = Collections.unmodifiableList(new ArrayList<>(collectibleSlots));
    }

    public String getName() {
        return name;
    }

    public double getArenaHalfExtent() {
        return arenaHalfExtent;
    }

    public List<Point3d> getPlayerSpawns() {
        return playerSpawns;
    }

    public List<CollectibleSlot> getCollectibleSlots() {
        return collectibleSlots;
    }

    public static class CollectibleSlot {
        private final String id;
        private final CollectibleType type;
        private final Point3d position;

        public CollectibleSlot(String id, CollectibleType type, Point3d position) {
            this.id = id;
            this.type = type;
            this.position = position;
        }

        public String getId() {
            return id;
        }

        public CollectibleType getType() {
            return type;
        }

        public Point3d getPosition() {
            return position;
        }
    }
}
