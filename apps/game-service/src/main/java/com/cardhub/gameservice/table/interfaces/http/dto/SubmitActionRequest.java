package com.cardhub.gameservice.table.interfaces.http.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * HTTP 提交动作。
 * action 为带 type 字段的动作 JSON，例如 {"type":"place_bet","playerId":"p2","amount":20}。
 */
public record SubmitActionRequest(@NotBlank String peerId, @NotNull JsonNode action) {
}
