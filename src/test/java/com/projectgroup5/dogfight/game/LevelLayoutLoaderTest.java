package com.projectgroup5.dogfight.game;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.*;

class LevelLayoutLoaderTest {

    private ObjectMapper mapper;
    private LevelLayoutLoader loader;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        loader = new LevelLayoutLoader(mapper);
    }

    @Test
    void testLoadDefaultLevel() {
        LevelLayout level = loader.load("default");
        assertEquals("default", level.getName());
        assertEquals(500.0, level.getArenaHalfExtent(), 1e-12);
        assertEquals(8, level.getPlayerSpawns().size());
        assertEquals(new Point3d(0, 0, 120), level.getPlayerSpawns().get(0));
        assertEquals(4, level.getCollectibleSlots().size());
        assertEquals("laser-core", level.getCollectibleSlots().get(3).getId());
        assertEquals(CollectibleType.LASER_UPGRADE, level.getCollectibleSlots().get(3).getType());
    }

    @Test
    void testMissingLevel() {
        assertThrows(UncheckedIOException.class, () -> loader.load("no-such-level"));
    }

    @Test
    void testGeneratedCollectibleIds() throws Exception {
        LevelLayout level = loader.parse("inline", mapper.readTree(
                "{\"playerSpawns\":[[1,2,3]],\"collectibles\":[{\"type\":\"missile_refill\",\"position\":[0,0,0]}]}"));
        assertEquals(500.0, level.getArenaHalfExtent(), 1e-12);
        assertEquals("c0", level.getCollectibleSlots().get(0).getId());
        assertEquals(CollectibleType.MISSILE_REFILL, level.getCollectibleSlots().get(0).getType());
    }

    @Test
    void testInvalidLevels() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> loader.parse("empty",
                mapper.readTree("{\"playerSpawns\":[]}")));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("short",
                mapper.readTree("{\"playerSpawns\":[[1,2]]}")));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("type",
                mapper.readTree("{\"playerSpawns\":[[1,2,3]],\"collectibles\":[{\"type\":\"shield\",\"position\":[0,0,0]}]}")));
    }
}
