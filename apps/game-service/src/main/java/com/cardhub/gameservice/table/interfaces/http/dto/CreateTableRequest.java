package com.cardhub.gameservice.table.interfaces.http.dto;

import com.cardhub.engine.core.GameType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/** 开桌请求：game 取 pokdeng / kang / poker / blackjack / slave / dummy */
public record CreateTableRequest(@NotNull GameType game,
                                 @NotBlank String hostId,
                                 String hostName) {
}
