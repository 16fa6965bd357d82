package com.projectgroup5.dogfight.game;

import com.projectgroup5.dogfight.config.GameProperties;
import com.projectgroup5.dogfight.game.system.CollectibleSpawner;
import com.projectgroup5.dogfight.game.system.CombatResolver;
import com.projectgroup5.dogfight.game.system.PhaseController;
import com.projectgroup5.dogfight.game.system.ShieldRegenerator;
import com.projectgroup5.dogfight.identity.PlayerIdentity;
import com.projectgroup5.dogfight.physics.AnalyticSweptShapeQuery;
import com.projectgroup5.dogfight.replication.RecordingSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GameRoomManagerTest {

    private GameProperties properties;
    private GameRoomManager manager;

    @BeforeEach
    void setUp() {
        properties = new GameProperties();
        manager = new GameRoomManager(properties, TestWorlds.level(),
                new CombatResolver(properties, new AnalyticSweptShapeQuery()),
                new ShieldRegenerator(properties), new CollectibleSpawner(properties),
                new PhaseController(properties));
    }

    @Test
    void testRoomsAreCreatedOnce() {
        GameRoom room = manager.getOrCreateRoom(3L);
        assertSame(room, manager.getOrCreateRoom(3L));
        assertNotSame(room, manager.getOrCreateRoom(4L));
        assertEquals(2, manager.getRooms().size());
        assertTrue(manager.getRoom(3L).isPresent());
        assertFalse(manager.getRoom(5L).isPresent());
    }

    @Test
    void testRoomsAreIndependent() {
        GameRoom a = manager.getOrCreateRoom(1L);
        GameRoom b = manager.getOrCreateRoom(2L);
        a.attach(new RecordingSink("c1"), new PlayerIdentity("pl-a", "A"), ShipClass.FIGHTER);
        a.step();
        assertEquals(1, a.getWorld().getPlayers().size());
        assertTrue(b.getWorld().getPlayers().isEmpty());
        assertEquals(0L, b.getWorld().getTick());
    }

    @Test
    void testShutdownRoom() {
        GameRoom room = manager.getOrCreateRoom(1L);
        RecordingSink sink = new RecordingSink("c1");
        room.attach(sink, new PlayerIdentity("pl-a", "A"), ShipClass.FIGHTER);

        manager.shutdownRoom(1L, "admin");
        assertTrue(room.isClosed());
        assertEquals("admin", sink.getCloseReason());
        assertFalse(manager.getRoom(1L).isPresent());

        // 同一个 id 再加入会得到新房间
        assertNotSame(room, manager.getOrCreateRoom(1L));
    }

    @Test
    void testRemoveIdleRooms() {
        GameRoom empty = manager.getOrCreateRoom(1L);
        GameRoom busy = manager.getOrCreateRoom(2L);
        busy.attach(new RecordingSink("c1"), new PlayerIdentity("pl-a", "A"), ShipClass.FIGHTER);

        long later = System.currentTimeMillis() + properties.getSimulation().getEmptyRoomGraceMillis() + 1000;
        List<Long> removed = manager.removeIdleRooms(later);
        assertEquals(Collections.singletonList(1L), removed);
        assertTrue(empty.isClosed());
        assertFalse(busy.isClosed());
        assertTrue(manager.removeIdleRooms(System.currentTimeMillis()).isEmpty());
    }
}
