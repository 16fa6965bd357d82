package com.projectgroup5.dogfight.game;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import javax.vecmath.Point3d;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 从 classpath:levels/{name}.json 读取关卡出生点数据
 */
@Component
public class LevelLayoutLoader {
    private static final Logger logger = LoggerFactory.getLogger(LevelLayoutLoader.class);

    private final ObjectMapper objectMapper;

    public LevelLayoutLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public LevelLayout load(String levelName) {
        ClassPathResource resource = new ClassPathResource("levels/" + levelName + ".json");
        try (InputStream in = resource.getInputStream()) {
            LevelLayout layout = parse(levelName, objectMapper.readTree(in));
            logger.info("Loaded level {}: {} player spawns, {} collectibles",
                    levelName, layout.getPlayerSpawns().size(), layout.getCollectibleSlots().size());
            return layout;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read level " + levelName, e);
        }
    }

    LevelLayout parse(String levelName, JsonNode root) {
        double halfExtent = root.path("arenaHalfExtent").asDouble(500.0);

        List<Point3d> spawns = new ArrayList<>();
        for (JsonNode node : root.path("playerSpawns")) {
            spawns.add(toPoint(node));
        }

        List<LevelLayout.CollectibleSlot> slots = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root.path("collectibles")) {
            CollectibleType type = CollectibleType.valueOf(
                    node.path("type").asText().toUpperCase(Locale.ROOT));
            String id = node.hasNonNull("id") ? node.get("id").asText() : "c" + index;
            slots.add(new LevelLayout.CollectibleSlot(id, type, toPoint(node.path("position"))));
            index++;
        }
        return new LevelLayout(levelName, halfExtent, spawns, slots);
    }

    private static Point3d toPoint(JsonNode node) {
        if (!node.isArray() || node.size() != 3) {
            throw new IllegalArgumentException("Expected [x, y, z] but got " + node);
        }
        return new Point3d(node.get(0).asDouble(), node.get(1).asDouble(), node.get(2).asDouble());
    }
}
