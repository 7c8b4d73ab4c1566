package com.cardhub.engine.replication;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 传输消息外壳（所有游戏复用）。
 * - 强类型泛型载荷：Envelope<T>
 * - 字段：kind / game / roomId / senderId / payload / ts / seq
 * - 静态工厂：state / action / error / of
 *
 * 用法示例：
 *   Envelope<TableSnapshot<PokDengState>> msg = Envelope.state("pokdeng", roomId, hostId, snapshot, seq);
 *   Envelope<ErrorPayload>                err = Envelope.error("pokdeng", roomId, hostId, ErrorPayload.of(ErrorPayload.REJECTED, "不是你的回合"));
 */
public final class Envelope<T> implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    /** STATE=完整快照（主机广播），ACTION=玩家意图（发给主机），ERROR=拒绝通知（只发给提交者） */
    public enum Kind { STATE, ACTION, ERROR }

    private final Kind kind;
    private final String game;      // pokdeng / poker / slave ...
    private final String roomId;
    private final String senderId;  // 发送方 peerId
    private final T payload;
    private final long ts;          // 发送时间戳（ms）
    private final long seq;         // STATE 为主机递增序号，其余传 0

    @JsonCreator
    private Envelope(@JsonProperty("kind") Kind kind,
                     @JsonProperty("game") String game,
                     @JsonProperty("roomId") String roomId,
                     @JsonProperty("senderId") String senderId,
                     @JsonProperty("payload") T payload,
                     @JsonProperty("ts") long ts,
                     @JsonProperty("seq") long seq) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.game = Objects.requireNonNull(game, "game");
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.senderId = senderId;
        this.payload = payload;
        this.ts = ts;
        this.seq = seq;
    }

    /** 自由构造（若不关心 seq，传 0） */
    public static <T> Envelope<T> of(Kind kind, String game, String roomId, String senderId, T payload, long seq) {
        return new Envelope<>(kind, game, roomId, senderId, payload, Instant.now().toEpochMilli(), seq);
    }

    /** 完整状态广播 */
    public static <T> Envelope<T> state(String game, String roomId, String senderId, T payload, long seq) {
        return of(Kind.STATE, game, roomId, senderId, payload, seq);
    }

    /** 玩家动作（镜像 → 主机） */
    public static <T> Envelope<T> action(String game, String roomId, String senderId, T payload) {
        return of(Kind.ACTION, game, roomId, senderId, payload, 0);
    }

    /** 错误通知（payload 用 ErrorPayload） */
    public static <T> Envelope<T> error(String game, String roomId, String senderId, T payload) {
        return of(Kind.ERROR, game, roomId, senderId, payload, 0);
    }

    // —— Getters ——（不可变对象，无 setters）
    @JsonProperty("kind")     public Kind kind()        { return kind; }
    @JsonProperty("game")     public String game()      { return game; }
    @JsonProperty("roomId")   public String roomId()    { return roomId; }
    @JsonProperty("senderId") public String senderId()  { return senderId; }
    @JsonProperty("payload")  public T payload()        { return payload; }
    @JsonProperty("ts")       public long ts()          { return ts; }
    @JsonProperty("seq")      public long seq()         { return seq; }

    @Override public String toString() {
        return "Envelope{" +
                "kind=" + kind +
                ", game='" + game + '\'' +
                ", roomId='" + roomId + '\'' +
                ", senderId='" + senderId + '\'' +
                ", ts=" + ts +
                ", seq=" + seq +
                '}';
    }
}
