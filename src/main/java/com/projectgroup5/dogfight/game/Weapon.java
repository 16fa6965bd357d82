package com.projectgroup5.dogfight.game;

import com.projectgroup5.dogfight.protocol.ValidationException;

import java.util.Locale;

/**
 * 武器类型
 * LASER 由服务器模拟，MISSILE 由发射者客户端驱动位置
 */
public enum Weapon {
    LASER,
    MISSILE;

    public static Weapon fromWire(String value) {
        if (value == null) {
            throw new ValidationException("weapon is missing");
        }
        try {
            return Weapon.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown weapon: " + value);
        }
    }
}
