package com.cardhub.engine.core;

/**
 * 统一的“玩家输入指令”抽象。
 * - 每个游戏用一个密封接口 + record 表达自己的动作集合；
 * - 传输层只需序列化 Command，对具体游戏透明；
 * - playerId 是发起动作的玩家，主机据此校验“谁在操作”。
 */
public interface Command {

    String playerId();

    /** 只允许主机发起（开局、收局） */
    default boolean hostOnly() {
        return false;
    }
}
