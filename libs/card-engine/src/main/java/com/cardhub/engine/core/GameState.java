package com.cardhub.engine.core;

/**
 * 游戏状态快照接口。
 * - 必须可 copy：主机广播、镜像替换都基于独立副本；
 * - 具体游戏的状态继承 {@link TableState}。
 */
public interface GameState extends Cloneable {

    /**
     * 返回当前状态的深拷贝快照。
     */
    GameState copy();
}
