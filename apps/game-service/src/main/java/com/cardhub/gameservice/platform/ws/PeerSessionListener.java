package com.cardhub.gameservice.platform.ws;

import com.cardhub.gameservice.table.infrastructure.ws.StompPeerChannel;
import com.cardhub.gameservice.table.service.TableSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.web.socket.messaging.SessionSubscribeEvent;

import java.security.Principal;

/**
 * STOMP 会话事件 → 牌桌在线状态
 *
 * 订阅 /user/queue/table.{roomId} 视为该对端连上这张桌（补发快照）；
 * WS 会话断开则通知所有牌桌的主机。事件里的用户由 {@link PeerIdChannelInterceptor} 在 CONNECT 时设置。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PeerSessionListener {

    static final String TABLE_QUEUE_PREFIX = "/user" + StompPeerChannel.userQueue("");

    private final TableSessionService tableSessionService;

    @EventListener
    public void handleSubscribe(SessionSubscribeEvent event) {
        Principal user = event.getUser();
        String destination = SimpMessageHeaderAccessor.getDestination(event.getMessage().getHeaders());
        if (user == null || destination == null || !destination.startsWith(TABLE_QUEUE_PREFIX)) {
            return;
        }
        String roomId = destination.substring(TABLE_QUEUE_PREFIX.length());
        if (StringUtils.isBlank(roomId)) {
            return;
        }
        log.debug("订阅牌桌队列 peer={} room={}", user.getName(), roomId);
        tableSessionService.peerSubscribed(roomId, user.getName());
    }

    @EventListener
    public void handleDisconnect(SessionDisconnectEvent event) {
        Principal user = event.getUser();
        if (user == null) {
            log.debug("匿名会话断开 session={}", event.getSessionId());
            return;
        }
        log.info("WS 会话断开 peer={} session={} status={}", user.getName(), event.getSessionId(), event.getCloseStatus());
        tableSessionService.peerDisconnected(user.getName());
    }
}
