package com.cardhub.gameservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * STOMP 身份拦截器
 *
 * 在 CONNECT 阶段读取 peerId 头，设置为会话用户，后续 /user/... 点对点投递依赖它。
 * 缺少 peerId 时不设置用户，该连接只能收广播。
 */
@Slf4j
@Component
public class PeerIdChannelInterceptor implements ChannelInterceptor {

    public static final String PEER_ID_HEADER = "peerId";

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor != null && StompCommand.CONNECT.equals(accessor.getCommand())) {
            String peerId = firstHeader(accessor, PEER_ID_HEADER);
            if (StringUtils.isNotBlank(peerId)) {
                accessor.setUser(new PeerPrincipal(peerId.trim()));
            } else {
                log.debug("CONNECT 缺少 {} 头，session={}", PEER_ID_HEADER, accessor.getSessionId());
            }
        }
        return message;
    }

    private static String firstHeader(StompHeaderAccessor accessor, String key) {
        List<String> vals = accessor.getNativeHeader(key);
        return (vals == null || vals.isEmpty()) ? null : vals.get(0);
    }
}
