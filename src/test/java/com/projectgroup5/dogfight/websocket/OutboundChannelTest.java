package com.projectgroup5.dogfight.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectgroup5.dogfight.protocol.ErrorMessage;
import com.projectgroup5.dogfight.protocol.KillMessage;
import com.projectgroup5.dogfight.protocol.MessageCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OutboundChannelTest {

    private WebSocketSession session;
    private MessageCodec codec;
    private List<String> payloads;
    private List<Runnable> deferred;

    @BeforeEach
    void setUp() throws IOException {
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(session.isOpen()).thenReturn(true);
        codec = new MessageCodec(new ObjectMapper());
        payloads = new ArrayList<>();
        deferred = new ArrayList<>();
        doAnswer(inv -> {
            payloads.add(((TextMessage) inv.getArgument(0)).getPayload());
            return null;
        }).when(session).sendMessage(any());
    }

    private OutboundChannel channel(TaskExecutor executor, int queueLimit) {
        return new OutboundChannel(session, codec, executor, 2000, 512 * 1024, queueLimit);
    }

    private void runDeferred() {
        while (!deferred.isEmpty()) {
            deferred.remove(0).run();
        }
    }

    @Test
    void testSendsEncodedJson() {
        OutboundChannel channel = channel(new SyncTaskExecutor(), 16);
        assertEquals("s1", channel.getConnectionId());
        channel.send(new ErrorMessage("hello"));
        assertEquals(1, payloads.size());
        assertTrue(payloads.get(0).contains("\"type\":\"error\""));
        assertEquals(0, channel.getQueuedCount());
    }

    @Test
    void testFullQueueDropsNewest() {
        OutboundChannel channel = channel(deferred::add, 3);
        for (int i = 0; i < 5; i++) {
            channel.send(new KillMessage("a", "b", i));
        }
        assertEquals(3, channel.getQueuedCount());
        assertEquals(2, channel.getDroppedCount());

        runDeferred();
        assertEquals(3, payloads.size());
        assertTrue(payloads.get(2).contains("\"tick\":2"));
    }

    @Test
    void testCloseDrainsQueueFirst() throws IOException {
        OutboundChannel channel = channel(deferred::add, 16);
        channel.send(new ErrorMessage("one"));
        channel.send(new ErrorMessage("two"));
        channel.close("room closed");
        channel.send(new ErrorMessage("late"));
        runDeferred();

        assertEquals(2, payloads.size());
        InOrder order = inOrder(session);
        order.verify(session, times(2)).sendMessage(any());
        order.verify(session).close(CloseStatus.GOING_AWAY.withReason("room closed"));
    }

    @Test
    void testSendFailureClosesChannel() throws IOException {
        doThrow(new IOException("broken pipe")).when(session).sendMessage(any());
        OutboundChannel channel = channel(new SyncTaskExecutor(), 16);
        channel.send(new ErrorMessage("one"));
        verify(session).close(CloseStatus.GOING_AWAY.withReason("send failed"));

        channel.send(new ErrorMessage("two"));
        verify(session, times(1)).sendMessage(any());
    }
}
