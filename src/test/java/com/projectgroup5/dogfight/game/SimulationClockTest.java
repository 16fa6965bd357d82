package com.projectgroup5.dogfight.game;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulationClockTest {

    private static final long STEP = 50_000_000L;

    @Test
    void testFirstCallOnlyPrimes() {
        SimulationClock clock = new SimulationClock(STEP, 5);
        assertEquals(0, clock.advance(123_456_789L));
        assertEquals(0, clock.advance(123_456_789L));
    }

    @Test
    void testAccumulatesPartialSteps() {
        SimulationClock clock = new SimulationClock(STEP, 5);
        clock.advance(0);
        assertEquals(0, clock.advance(49_000_000L));
        assertEquals(1, clock.advance(50_000_000L));
        assertEquals(2, clock.advance(150_000_000L));
        // 剩余 0，再过 30ms 不足一步
        assertEquals(0, clock.advance(180_000_000L));
        assertEquals(1, clock.advance(200_000_000L));
    }

    @Test
    void testCatchUpIsCapped() {
        SimulationClock clock = new SimulationClock(STEP, 5);
        clock.advance(0);
        assertEquals(5, clock.advance(1_000_000_000L));
        assertEquals(15, clock.getDroppedSteps());
        // 多余的时间已经丢弃，不会在下次补回来
        assertEquals(0, clock.advance(1_010_000_000L));
    }

    @Test
    void testClockGoingBackwardsRunsNothing() {
        SimulationClock clock = new SimulationClock(STEP, 5);
        clock.advance(100_000_000L);
        assertEquals(0, clock.advance(50_000_000L));
    }

    @Test
    void testRejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new SimulationClock(0, 5));
        assertThrows(IllegalArgumentException.class, () -> new SimulationClock(STEP, 0));
    }
}
