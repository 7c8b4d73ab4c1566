package com.cardhub.gameservice.table.interfaces.http;

import com.cardhub.engine.core.GameType;
import com.cardhub.gameservice.common.WebExceptionAdvice;
import com.cardhub.gameservice.table.domain.model.TableNotFoundException;
import com.cardhub.gameservice.table.domain.model.TableView;
import com.cardhub.gameservice.table.service.TableSessionService;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TableRestControllerTest {

    private TableSessionService service;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        service = mock(TableSessionService.class);
        mvc = MockMvcBuilders.standaloneSetup(new TableRestController(service))
                .setControllerAdvice(new WebExceptionAdvice())
                .build();
    }

    @Test
    @DisplayName("开桌返回房间号")
    void create() throws Exception {
        when(service.createTable(GameType.POKDENG, "host", "庄家")).thenReturn("r1");
        mvc.perform(post("/api/tables")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"game\":\"pokdeng\",\"hostId\":\"host\",\"hostName\":\"庄家\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data").value("r1"));
    }

    @Test
    @DisplayName("查询快照")
    void view() throws Exception {
        when(service.view("r1")).thenReturn(new TableView("r1", GameType.SLAVE, "host", 3, null, List.of(), List.of()));
        mvc.perform(get("/api/tables/r1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.game").value("slave"))
                .andExpect(jsonPath("$.data.seq").value(3));
    }

    @Test
    @DisplayName("动作被拒绝映射为 409")
    void rejectedIsConflict() throws Exception {
        when(service.submit(eq("r1"), eq("alice"), any(JsonNode.class)))
                .thenThrow(new IllegalStateException("ACTION_REJECTED: 动作不合法: draw"));
        mvc.perform(post("/api/tables/r1/actions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"peerId\":\"alice\",\"action\":{\"type\":\"draw\",\"playerId\":\"alice\"}}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value(409));
    }

    @Test
    @DisplayName("无法解析的动作映射为 400")
    void badActionIsBadRequest() throws Exception {
        when(service.submit(eq("r1"), eq("alice"), any(JsonNode.class)))
                .thenThrow(new IllegalArgumentException("动作载荷无法解析"));
        mvc.perform(post("/api/tables/r1/actions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"peerId\":\"alice\",\"action\":{\"type\":\"shuffle\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));
    }

    @Test
    @DisplayName("牌桌不存在映射为 404")
    void unknownTable() throws Exception {
        doThrow(new TableNotFoundException("nope")).when(service).closeTable("nope");
        mvc.perform(delete("/api/tables/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    @DisplayName("离座")
    void leave() throws Exception {
        when(service.leave("r1", "alice")).thenReturn(new TableView("r1", GameType.KANG, "host", 5, null, List.of(), List.of()));
        mvc.perform(delete("/api/tables/r1/players/alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.seq").value(5));
        verify(service).leave("r1", "alice");
    }
}
