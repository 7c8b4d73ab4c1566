package com.cardhub.engine.games.slave.domain.enums;

/**
 * 两套桌规，开桌时选定。
 * <ul>
 *   <li>CLASSIC：同点比花色；首局梅花 3 先出，之后由上局奴隶先出；三条可压单张；四条可压单张/对子。</li>
 *   <li>HOUSE_BOMB：只比点数；每局都由梅花 3 先出；三条不能压单张；四条（炸弹）可压任何非四条牌型。</li>
 * </ul>
 */
public enum SlavePreset {

    CLASSIC(true, true, true, false),
    HOUSE_BOMB(false, false, false, true);

    private final boolean suitTieBreak;
    private final boolean previousSlaveStarts;
    private final boolean tripleBeatsSingle;
    private final boolean bombBeatsAnyType;

    SlavePreset(boolean suitTieBreak, boolean previousSlaveStarts,
                boolean tripleBeatsSingle, boolean bombBeatsAnyType) {
        this.suitTieBreak = suitTieBreak;
        this.previousSlaveStarts = previousSlaveStarts;
        this.tripleBeatsSingle = tripleBeatsSingle;
        this.bombBeatsAnyType = bombBeatsAnyType;
    }

    public boolean suitTieBreak() {
        return suitTieBreak;
    }

    public boolean previousSlaveStarts() {
        return previousSlaveStarts;
    }

    public boolean tripleBeatsSingle() {
        return tripleBeatsSingle;
    }

    public boolean bombBeatsAnyType() {
        return bombBeatsAnyType;
    }
}
