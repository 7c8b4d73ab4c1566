package com.cardhub.gameservice.table.interfaces.ws;

import com.cardhub.gameservice.table.interfaces.ws.dto.TableMessages.SyncCmd;
import com.cardhub.gameservice.table.service.TableSessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.nio.charset.StandardCharsets;
import java.security.Principal;

/**
 * 牌桌 WebSocket 控制器
 * ----------------------------------------
 * /app/table.action：收到 ACTION 外壳后排队交给牌桌主机，结果通过广播或点对点 ERROR 返回；
 * /app/table.sync  ：请求点对点补发一份当前快照。
 */
@Controller
@RequiredArgsConstructor
public class TableWsController {

    private final TableSessionService tableService;

    @MessageMapping("/table.action")
    public void action(@Payload byte[] body, SimpMessageHeaderAccessor sha) {
        // 原始字节交给复制层解码，不经过消息转换器
        tableService.deliver(peerOf(sha), new String(body, StandardCharsets.UTF_8));
    }

    @MessageMapping("/table.sync")
    public void sync(SyncCmd cmd, SimpMessageHeaderAccessor sha) {
        String peerId = peerOf(sha);
        tableService.resync(cmd.getRoomId(), peerId != null ? peerId : cmd.getPeerId());
    }

    private static String peerOf(SimpMessageHeaderAccessor sha) {
        Principal user = sha.getUser();
        return user == null ? null : user.getName();
    }
}
