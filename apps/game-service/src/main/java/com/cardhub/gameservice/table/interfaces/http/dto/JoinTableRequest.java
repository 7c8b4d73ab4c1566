package com.cardhub.gameservice.table.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;

public record JoinTableRequest(@NotBlank String playerId, String displayName) {
}
