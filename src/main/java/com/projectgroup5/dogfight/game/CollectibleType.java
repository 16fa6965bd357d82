package com.projectgroup5.dogfight.game;

public enum CollectibleType {
    MISSILE_REFILL,
    LASER_UPGRADE
}
