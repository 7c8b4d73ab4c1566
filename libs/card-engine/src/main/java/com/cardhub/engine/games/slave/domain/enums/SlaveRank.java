package com.cardhub.engine.games.slave.domain.enums;

/**
 * 名次称号。2 人：大富豪/奴隶；3 人：+ 平民；4 人：大富豪/副富豪/副奴隶/奴隶。
 */
public enum SlaveRank {

    PRESIDENT,
    VICE_PRESIDENT,
    CITIZEN,
    VICE_SLAVE,
    SLAVE;

    /** 按出完顺序（1 起）与人数换算称号 */
    public static SlaveRank of(int finishOrder, int playerCount) {
        if (finishOrder == 1) return PRESIDENT;
        if (finishOrder == playerCount) return SLAVE;
        if (playerCount == 3) return CITIZEN;
        return finishOrder == 2 ? VICE_PRESIDENT : VICE_SLAVE;
    }
}
