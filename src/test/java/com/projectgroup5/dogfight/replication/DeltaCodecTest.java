package com.projectgroup5.dogfight.replication;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectgroup5.dogfight.game.GamePhase;
import com.projectgroup5.dogfight.game.GameWorld;
import com.projectgroup5.dogfight.game.PlayerEntity;
import com.projectgroup5.dogfight.game.ProjectileEntity;
import com.projectgroup5.dogfight.game.ShipMotionModel;
import com.projectgroup5.dogfight.game.TestWorlds;
import com.projectgroup5.dogfight.game.Weapon;
import com.projectgroup5.dogfight.protocol.SnapshotDecodeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class DeltaCodecTest {

    private GameWorld world;

    @BeforeEach
    void setUp() {
        world = TestWorlds.world();
        TestWorlds.addPlayer(world, "a", 0, 0, 0);
        TestWorlds.addPlayer(world, "b", 50, 0, 0);
    }

    private WorldSnapshot capture() {
        world.advanceTick();
        return WorldSnapshot.capture(world);
    }

    private void addLaser(String id) {
        world.getProjectiles().put(id, new ProjectileEntity(id, "a", Weapon.LASER, new Point3d(1, 2, 3),
                new Vector3d(0, 0, 1), 200.0, 10, 0.3, 3.0, world.getTick(), true));
    }

    @Test
    void testFullDeltaRebuildsWorld() throws SnapshotDecodeException {
        addLaser("p1");
        WorldSnapshot snapshot = capture();
        StateDelta delta = DeltaCodec.diff(null, snapshot);

        assertTrue(delta.isFull());
        assertEquals(2, delta.getPlayers().size());
        assertNull(delta.getRemovedPlayers());

        WorldSnapshot rebuilt = DeltaCodec.apply(null, delta);
        assertEquals(snapshot, rebuilt);
    }

    @Test
    void testOnlyChangedFieldsAreSent() {
        WorldSnapshot base = capture();
        PlayerEntity a = world.getPlayers().get("a");
        a.position.set(1, 0, 0);
        a.health = 90;
        WorldSnapshot current = capture();

        StateDelta delta = DeltaCodec.diff(base, current);
        assertFalse(delta.isFull());
        assertEquals(base.getTick(), delta.getBaseTick());
        assertNull(delta.getPhase());
        assertNull(delta.getCollectibles());
        assertEquals(1, delta.getPlayers().size());

        PlayerDelta d = delta.getPlayers().get(0);
        assertEquals("a", d.getId());
        assertArrayEquals(new double[]{1, 0, 0}, d.getPosition());
        assertEquals(90.0, d.getHealth());
        assertNull(d.getName());
        assertNull(d.getRotation());
        assertNull(d.getKills());
    }

    @Test
    void testBoostFieldsReplicate() throws SnapshotDecodeException {
        WorldSnapshot base = capture();
        PlayerEntity a = world.getPlayers().get("a");
        a.boost.refill();
        new ShipMotionModel(0.97, 500.0)
                .updateBoost(a.boost, true, true, world.getSimTime(), TestWorlds.DT);
        WorldSnapshot current = capture();

        StateDelta delta = DeltaCodec.diff(base, current);
        PlayerDelta d = delta.getPlayers().get(0);
        assertEquals(199.0, d.getBoostFuel(), 1e-9);
        assertEquals(Boolean.TRUE, d.getBoosting());
        assertNull(d.getPosition());

        WorldSnapshot rebuilt = DeltaCodec.apply(base, delta);
        assertTrue(rebuilt.getPlayers().get("a").isBoosting());
        assertEquals(current, rebuilt);
    }

    @Test
    void testUnchangedWorldGivesEmptyDelta() {
        WorldSnapshot base = capture();
        WorldSnapshot current = capture();
        StateDelta delta = DeltaCodec.diff(base, current);
        assertTrue(delta.isEmpty());
        assertEquals(current.getTick(), delta.getTick());
    }

    @Test
    void testApplyPartialDelta() throws SnapshotDecodeException {
        addLaser("p1");
        WorldSnapshot base = capture();

        world.getPlayers().get("b").kills = 2;
        world.getPlayers().remove("a");
        world.getProjectiles().get("p1").position.set(1, 2, 13);
        addLaser("p2");
        world.getCollectibles().get("c-laser").active = false;
        world.getCollectibles().get("c-laser").respawnRemaining = 15;
        world.setPhase(GamePhase.COUNTDOWN);
        world.setPhaseTimer(5.0);
        WorldSnapshot current = capture();

        StateDelta delta = DeltaCodec.diff(base, current);
        assertEquals(Collections.singletonList("a"), delta.getRemovedPlayers());
        assertEquals("COUNTDOWN", delta.getPhase());

        WorldSnapshot rebuilt = DeltaCodec.apply(base, delta);
        assertEquals(current, rebuilt);
    }

    @Test
    void testExistingProjectileSendsOnlyMotion() {
        addLaser("p1");
        WorldSnapshot base = capture();
        world.getProjectiles().get("p1").position.set(1, 2, 13);
        StateDelta delta = DeltaCodec.diff(base, capture());

        ProjectileDelta d = delta.getProjectiles().get(0);
        assertNotNull(d.getPosition());
        assertNull(d.getDirection());
        assertNull(d.getOwnerId());
        assertNull(d.getDamage());
    }

    @Test
    void testRemovedProjectile() throws SnapshotDecodeException {
        addLaser("p1");
        WorldSnapshot base = capture();
        world.getProjectiles().clear();
        WorldSnapshot current = capture();

        StateDelta delta = DeltaCodec.diff(base, current);
        assertEquals(Collections.singletonList("p1"), delta.getRemovedProjectiles());
        assertTrue(DeltaCodec.apply(base, delta).getProjectiles().isEmpty());
    }

    @Test
    void testDeltaSurvivesJson() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        addLaser("p1");
        WorldSnapshot base = capture();
        world.getPlayers().get("a").rotation.set(0, 0.6, 0, 0.8);
        world.getProjectiles().get("p1").position.set(1, 2, 13);
        WorldSnapshot current = capture();

        String json = mapper.writeValueAsString(DeltaCodec.diff(base, current));
        JsonNode node = mapper.readTree(json);
        // 短字段名，未变化的字段不出现
        assertTrue(node.has("pl"));
        assertFalse(node.has("co"));
        assertFalse(node.has("empty"));
        assertFalse(node.get("pl").get(0).has("n"));

        StateDelta decoded = mapper.readValue(json, StateDelta.class);
        assertEquals(current, DeltaCodec.apply(base, decoded));
    }

    @Test
    void testPartialDeltaWithoutBaselineFails() {
        WorldSnapshot base = capture();
        world.getPlayers().get("a").health = 10;
        StateDelta delta = DeltaCodec.diff(base, capture());
        assertThrows(SnapshotDecodeException.class, () -> DeltaCodec.apply(null, delta));
    }

    @Test
    void testBaselineTickMismatchFails() {
        WorldSnapshot older = capture();
        WorldSnapshot base = capture();
        world.getPlayers().get("a").health = 10;
        StateDelta delta = DeltaCodec.diff(base, capture());
        assertThrows(SnapshotDecodeException.class, () -> DeltaCodec.apply(older, delta));
    }

    @Test
    void testNewEntityMissingFieldsFails() {
        WorldSnapshot base = capture();
        StateDelta delta = new StateDelta();
        delta.setTick(base.getTick() + 1);
        delta.setBaseTick(base.getTick());
        PlayerDelta stranger = new PlayerDelta("c");
        stranger.setHealth(50.0);
        delta.setPlayers(Collections.singletonList(stranger));
        assertThrows(SnapshotDecodeException.class, () -> DeltaCodec.apply(base, delta));
    }

    @Test
    void testFullDeltaWithoutPhaseFails() {
        StateDelta delta = new StateDelta();
        delta.setTick(1);
        delta.setFull(true);
        assertThrows(SnapshotDecodeException.class, () -> DeltaCodec.apply(null, delta));
    }

    @Test
    void testWrongVectorLengthFails() {
        WorldSnapshot base = capture();
        StateDelta delta = new StateDelta();
        delta.setTick(base.getTick() + 1);
        delta.setBaseTick(base.getTick());
        PlayerDelta bad = new PlayerDelta("a");
        bad.setPosition(new double[]{1, 2});
        delta.setPlayers(Collections.singletonList(bad));
        assertThrows(SnapshotDecodeException.class, () -> DeltaCodec.apply(base, delta));
    }
}
