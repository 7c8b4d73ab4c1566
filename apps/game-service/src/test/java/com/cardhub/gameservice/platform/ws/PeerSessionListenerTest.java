package com.cardhub.gameservice.platform.ws;

import com.cardhub.gameservice.table.service.TableSessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.Message;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.web.socket.messaging.SessionSubscribeEvent;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class PeerSessionListenerTest {

    private TableSessionService service;
    private PeerSessionListener listener;

    @BeforeEach
    void setUp() {
        service = mock(TableSessionService.class);
        listener = new PeerSessionListener(service);
    }

    private static Message<byte[]> stomp(StompCommand command, String destination) {
        StompHeaderAccessor acc = StompHeaderAccessor.create(command);
        acc.setSessionId("s1");
        if (destination != null) {
            acc.setDestination(destination);
        }
        return MessageBuilder.createMessage(new byte[0], acc.getMessageHeaders());
    }

    @Test
    @DisplayName("订阅牌桌私有队列时登记在线")
    void subscribeToTableQueue() {
        listener.handleSubscribe(new SessionSubscribeEvent(this,
                stomp(StompCommand.SUBSCRIBE, "/user/queue/table.r1"), new PeerPrincipal("alice")));
        verify(service).peerSubscribed("r1", "alice");
    }

    @Test
    @DisplayName("广播订阅、匿名订阅、空房间号都忽略")
    void ignoresOtherSubscriptions() {
        listener.handleSubscribe(new SessionSubscribeEvent(this,
                stomp(StompCommand.SUBSCRIBE, "/topic/table.r1"), new PeerPrincipal("alice")));
        listener.handleSubscribe(new SessionSubscribeEvent(this,
                stomp(StompCommand.SUBSCRIBE, "/user/queue/table.r1"), null));
        listener.handleSubscribe(new SessionSubscribeEvent(this,
                stomp(StompCommand.SUBSCRIBE, "/user/queue/table."), new PeerPrincipal("alice")));
        verifyNoInteractions(service);
    }

    @Test
    @DisplayName("会话断开通知所有牌桌，匿名会话忽略")
    void disconnect() {
        listener.handleDisconnect(new SessionDisconnectEvent(this,
                stomp(StompCommand.DISCONNECT, null), "s1", CloseStatus.NORMAL, new PeerPrincipal("alice")));
        verify(service).peerDisconnected("alice");

        TableSessionService other = mock(TableSessionService.class);
        new PeerSessionListener(other).handleDisconnect(new SessionDisconnectEvent(this,
                stomp(StompCommand.DISCONNECT, null), "s2", CloseStatus.GOING_AWAY, null));
        verifyNoInteractions(other);
    }
}
