package com.projectgroup5.dogfight.game.system;

import com.projectgroup5.dogfight.config.GameProperties;
import com.projectgroup5.dogfight.game.GamePhase;
import com.projectgroup5.dogfight.game.GameWorld;
import com.projectgroup5.dogfight.game.PlayerEntity;
import com.projectgroup5.dogfight.game.ProjectileEntity;
import com.projectgroup5.dogfight.game.TestWorlds;
import com.projectgroup5.dogfight.game.Weapon;
import com.projectgroup5.dogfight.physics.AnalyticSweptShapeQuery;
import com.projectgroup5.dogfight.protocol.HitMessage;
import com.projectgroup5.dogfight.protocol.KillMessage;
import com.projectgroup5.dogfight.protocol.RespawnMessage;
import com.projectgroup5.dogfight.protocol.ServerMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CombatResolverTest {

    private GameWorld world;
    private CombatResolver resolver;

    @BeforeEach
    void setUp() {
        world = TestWorlds.world();
        world.setPhase(GamePhase.PLAYING);
        resolver = new CombatResolver(new GameProperties(), new AnalyticSweptShapeQuery());
    }

    private ProjectileEntity laser(String id, String owner, Point3d from, Vector3d direction, int damage, double lifetime) {
        ProjectileEntity projectile = new ProjectileEntity(id, owner, Weapon.LASER, from, direction,
                200.0, damage, 0.3, lifetime, world.getTick(), true);
        world.getProjectiles().put(id, projectile);
        return projectile;
    }

    private void step() {
        world.advanceTick();
        resolver.resolve(world, TestWorlds.DT);
    }

    @Test
    @DisplayName("A 25 damage hit on a 40 hp ship leaves it alive at 15")
    void testHitReducesHealth() {
        TestWorlds.addPlayer(world, "attacker", 0, 0, -50);
        PlayerEntity target = TestWorlds.addPlayer(world, "target", 5, 0, 0);
        target.health = 40;
        laser("p1", "attacker", new Point3d(0, 0, 0), new Vector3d(1, 0, 0), 25, 3.0);

        step();

        assertEquals(15.0, target.health, 1e-12);
        assertTrue(target.alive);
        assertTrue(world.getProjectiles().isEmpty());
        assertEquals(world.getSimTime(), target.lastDamageTime, 1e-12);

        List<ServerMessage> events = world.drainEvents();
        assertEquals(1, events.size());
        HitMessage hit = (HitMessage) events.get(0);
        assertEquals("target", hit.getTargetId());
        assertEquals("attacker", hit.getAttackerId());
        assertEquals(25.0, hit.getAmount(), 1e-12);
        assertEquals(1, hit.getTick());
    }

    @Test
    @DisplayName("A lethal hit clamps health, credits the killer and schedules a respawn")
    void testLethalHitAndRespawn() {
        PlayerEntity attacker = TestWorlds.addPlayer(world, "attacker", 0, 0, -50);
        PlayerEntity target = TestWorlds.addPlayer(world, "target", 5, 0, 0);
        target.health = 10;
        target.velocity.set(3, 0, 0);
        laser("p1", "attacker", new Point3d(0, 0, 0), new Vector3d(1, 0, 0), 25, 3.0);

        step();

        assertEquals(0.0, target.health, 1e-12);
        assertFalse(target.alive);
        assertEquals(0.0, target.velocity.length(), 1e-12);
        assertEquals(1, target.deaths);
        assertEquals(1, attacker.kills);
        assertEquals(3.0, target.respawnRemaining, 1e-12);

        List<ServerMessage> events = world.drainEvents();
        assertEquals(2, events.size());
        assertEquals(10.0, ((HitMessage) events.get(0)).getAmount(), 1e-12);
        KillMessage kill = (KillMessage) events.get(1);
        assertEquals("attacker", kill.getKillerId());
        assertEquals("target", kill.getVictimId());

        // 3 秒 = 60 个 tick
        for (int i = 0; i < 59; i++) {
            step();
        }
        assertFalse(target.alive);
        assertTrue(world.drainEvents().isEmpty());

        step();
        assertTrue(target.alive);
        assertEquals(target.maxHealth, target.health, 1e-12);
        List<ServerMessage> respawn = world.drainEvents();
        assertEquals(1, respawn.size());
        assertEquals("target", ((RespawnMessage) respawn.get(0)).getPlayerId());
    }

    @Test
    void testDeadPlayersAreNotHit() {
        TestWorlds.addPlayer(world, "attacker", 0, 0, -50);
        PlayerEntity target = TestWorlds.addPlayer(world, "target", 5, 0, 0);
        target.alive = false;
        target.respawnRemaining = 10;
        laser("p1", "attacker", new Point3d(0, 0, 0), new Vector3d(1, 0, 0), 25, 3.0);

        step();

        assertEquals(1, world.getProjectiles().size());
        assertEquals(100.0, target.health, 1e-12);
    }

    @Test
    @DisplayName("A projectile is removed in the tick its lifetime reaches zero")
    void testLifetimeBoundary() {
        laser("p1", "nobody", new Point3d(0, 0, 0), new Vector3d(0, 1, 0), 10, 0.15);

        step();
        step();
        assertEquals(1, world.getProjectiles().size());
        step();
        assertTrue(world.getProjectiles().isEmpty());
    }

    @Test
    void testEarliestHitWins() {
        TestWorlds.addPlayer(world, "attacker", 0, 0, -50);
        PlayerEntity far = TestWorlds.addPlayer(world, "far", 8, 0, 0);
        PlayerEntity near = TestWorlds.addPlayer(world, "near", 4, 0, 0);
        laser("p1", "attacker", new Point3d(0, 0, 0), new Vector3d(1, 0, 0), 10, 3.0);

        step();

        assertEquals(90.0, near.health, 1e-12);
        assertEquals(100.0, far.health, 1e-12);
    }

    @Test
    void testOwnerIsNeverHit() {
        PlayerEntity owner = TestWorlds.addPlayer(world, "owner", 0, 0, 0);
        laser("p1", "owner", new Point3d(0, 0, 0), new Vector3d(1, 0, 0), 10, 3.0);

        step();

        assertEquals(100.0, owner.health, 1e-12);
        assertEquals(1, world.getProjectiles().size());
    }

    @Test
    void testOwnerDrivenMissileKeepsReportedPosition() {
        TestWorlds.addPlayer(world, "owner", 0, 0, -50);
        ProjectileEntity missile = new ProjectileEntity("owner:m1", "owner", Weapon.MISSILE,
                new Point3d(0, 0, 0), new Vector3d(0, 1, 0), 60.0, 40, 0.6, 8.0, 0, false);
        world.getProjectiles().put(missile.id, missile);

        step();
        assertEquals(0.0, missile.position.y, 1e-12);

        // 所有者上报的新位置作为扫掠终点
        PlayerEntity target = TestWorlds.addPlayer(world, "target", 0, 10, 0);
        missile.position.set(0, 20, 0);
        step();
        assertEquals(60.0, target.health, 1e-12);
        assertFalse(world.getProjectiles().containsKey("owner:m1"));
    }

    @Test
    @DisplayName("Orphaned missiles keep flying on their last heading")
    void testOrphanedMissileExtrapolates() {
        ProjectileEntity missile = new ProjectileEntity("gone:m1", "gone", Weapon.MISSILE,
                new Point3d(0, 0, 0), new Vector3d(0, 1, 0), 60.0, 40, 0.6, 8.0, 0, false);
        missile.orphaned = true;
        world.getProjectiles().put(missile.id, missile);

        step();
        assertEquals(3.0, missile.position.y, 1e-9);

        PlayerEntity target = TestWorlds.addPlayer(world, "target", 0, 7, 0);
        step();
        assertEquals(60.0, target.health, 1e-12);
        assertTrue(target.alive);
        List<ServerMessage> events = world.drainEvents();
        assertEquals("gone", ((HitMessage) events.get(0)).getAttackerId());
    }

    @Test
    void testKillByDepartedOwnerCreditsNobody() {
        PlayerEntity target = TestWorlds.addPlayer(world, "target", 5, 0, 0);
        target.health = 5;
        laser("p1", "gone", new Point3d(0, 0, 0), new Vector3d(1, 0, 0), 10, 3.0);

        step();

        assertFalse(target.alive);
        assertEquals(1, target.deaths);
        List<ServerMessage> events = world.drainEvents();
        assertEquals("gone", ((KillMessage) events.get(1)).getKillerId());
    }
}
