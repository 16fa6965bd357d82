package com.projectgroup5.dogfight.game;

import com.projectgroup5.dogfight.config.GameProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;

import java.util.Collections;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GameTickSchedulerTest {

    private GameRoomManager manager;
    private GameRoom room;
    private GameTickScheduler scheduler;

    @BeforeEach
    void setUp() {
        manager = mock(GameRoomManager.class);
        room = mock(GameRoom.class);
        when(room.getRoomId()).thenReturn(7L);
        when(manager.getRooms()).thenReturn(Collections.singletonList(room));
        scheduler = new GameTickScheduler(manager, new SyncTaskExecutor(), new GameProperties());
    }

    @Test
    void testPumpAdvancesEveryRoom() {
        scheduler.pump();
        verify(room).advance(anyLong());
    }

    @Test
    void testSingleFaultKeepsRoomAlive() {
        when(room.advance(anyLong())).thenThrow(new IllegalStateException("boom"));
        when(room.recordFault()).thenReturn(1);

        scheduler.runRoom(room, 0L);
        verify(room).recordFault();
        verify(manager, never()).shutdownRoom(anyLong(), anyString());
    }

    @Test
    void testRepeatedFaultsShutDownRoom() {
        when(room.advance(anyLong())).thenThrow(new IllegalStateException("boom"));
        when(room.recordFault()).thenReturn(1, 2, 3, 4, 5);

        for (int i = 0; i < 4; i++) {
            scheduler.runRoom(room, i);
        }
        verify(manager, never()).shutdownRoom(anyLong(), anyString());

        scheduler.runRoom(room, 5L);
        verify(manager, times(1)).shutdownRoom(eq(7L), anyString());
    }

    @Test
    void testCleanupDelegatesToManager() {
        scheduler.cleanupIdleRooms();
        verify(manager).removeIdleRooms(anyLong());
    }
}
