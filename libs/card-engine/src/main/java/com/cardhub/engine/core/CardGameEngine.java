package com.cardhub.engine.core;

/**
 * 牌桌引擎统一接口（每个游戏一个实现）。
 * <ul>
 *   <li>addPlayer/removePlayer：只在两局之间（WAITING）允许；</li>
 *   <li>apply：唯一的状态修改入口，违规动作返回 false，不抛异常；</li>
 *   <li>getState/setState/serialize：只给复制层使用。</li>
 * </ul>
 */
public interface CardGameEngine<S extends TableState<?>, A extends Command> {

    GameType gameType();

    Class<S> stateType();

    Class<A> actionType();

    /** 当前状态（实盘引用，只读使用） */
    S getState();

    /** 整体替换状态（镜像同步），牌堆从快照恢复 */
    void setState(S state);

    /** 状态 + 牌堆快照的独立副本 */
    S serialize();

    boolean addPlayer(String playerId, String displayName);

    boolean removePlayer(String playerId);

    boolean apply(A action);
}
