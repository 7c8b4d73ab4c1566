package com.cardhub.gameservice.table.interfaces.http;

import com.cardhub.gameservice.table.domain.model.TableView;
import com.cardhub.gameservice.table.interfaces.http.dto.CreateTableRequest;
import com.cardhub.gameservice.table.interfaces.http.dto.JoinTableRequest;
import com.cardhub.gameservice.table.interfaces.http.dto.SubmitActionRequest;
import com.cardhub.gameservice.table.service.TableSessionService;
import com.cardhub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 牌桌 HTTP 接口
 * 变更类接口成功后，最新快照同时会通过 /topic/table.{roomId} 广播。
 */
@Slf4j
@RestController
@RequestMapping("/api/tables")
@RequiredArgsConstructor
public class TableRestController {

    private final TableSessionService tableService;

    /** 开桌，返回房间号 */
    @PostMapping
    public ResponseEntity<ApiResponse<String>> create(@Valid @RequestBody CreateTableRequest req) {
        String roomId = tableService.createTable(req.game(), req.hostId(), req.hostName());
        return ResponseEntity.ok(ApiResponse.success(roomId));
    }

    /** 首屏 / 调试：当前完整快照 */
    @GetMapping("/{roomId}")
    public ResponseEntity<ApiResponse<TableView>> view(@PathVariable String roomId) {
        return ResponseEntity.ok(ApiResponse.success(tableService.view(roomId)));
    }

    @PostMapping("/{roomId}/players")
    public ResponseEntity<ApiResponse<TableView>> join(@PathVariable String roomId,
                                                       @Valid @RequestBody JoinTableRequest req) {
        return ResponseEntity.ok(ApiResponse.success(tableService.join(roomId, req.playerId(), req.displayName())));
    }

    @DeleteMapping("/{roomId}/players/{playerId}")
    public ResponseEntity<ApiResponse<TableView>> leave(@PathVariable String roomId,
                                                        @PathVariable String playerId) {
        return ResponseEntity.ok(ApiResponse.success(tableService.leave(roomId, playerId)));
    }

    /** 提交动作：被拒绝返回 409，动作 JSON 无法解析返回 400 */
    @PostMapping("/{roomId}/actions")
    public ResponseEntity<ApiResponse<TableView>> submit(@PathVariable String roomId,
                                                         @Valid @RequestBody SubmitActionRequest req) {
        return ResponseEntity.ok(ApiResponse.success(tableService.submit(roomId, req.peerId(), req.action())));
    }

    @DeleteMapping("/{roomId}")
    public ResponseEntity<ApiResponse<Void>> close(@PathVariable String roomId) {
        tableService.closeTable(roomId);
        return ResponseEntity.ok(ApiResponse.success("closed", null));
    }
}
