package com.cardhub.gameservice.table.domain.model;

import com.cardhub.gameservice.table.domain.constants.GameMessages;

/** 房间号没有对应的牌桌（HTTP 404） */
public class TableNotFoundException extends RuntimeException {

    public TableNotFoundException(String roomId) {
        super(GameMessages.formatTableNotFound(roomId));
    }
}
