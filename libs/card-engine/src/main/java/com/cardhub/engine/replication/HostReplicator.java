package com.cardhub.engine.replication;

import com.cardhub.engine.core.CardGameEngine;
import com.cardhub.engine.core.Command;
import com.cardhub.engine.core.TableState;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 主机端复制：唯一写者。
 * 1) 收到 ACTION：校验房间、发送者身份与主机专属动作；
 * 2) 交给引擎 apply；
 * 3) 成功则 seq+1、记日志并广播完整快照；失败只给提交者回 ERROR。
 * 调用方必须保证所有方法在同一条线程上顺序执行（会话层的入站队列）。
 */
@Slf4j
public class HostReplicator<S extends TableState<?>, A extends Command> {

    private final CardGameEngine<S, A> engine;
    private final PeerChannel channel;
    private final SnapshotCodec codec;
    private final String roomId;
    private final String hostPeerId;
    private final ActionLog actionLog;
    private long seq;

    public HostReplicator(CardGameEngine<S, A> engine, PeerChannel channel, SnapshotCodec codec,
                          String roomId, String hostPeerId) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.hostPeerId = Objects.requireNonNull(hostPeerId, "hostPeerId");
        this.actionLog = new ActionLog();
        channel.onReceive(this::onMessage);
        channel.onConnectionChange(this::onConnectionChange);
    }

    /**
     * 主机本地提交（主机自己也是玩家，或执行开局/收局）。
     * @return 引擎是否接受
     */
    public boolean submitLocal(A action) {
        return applyAndBroadcast(action);
    }

    /** 登记玩家（只在两局之间有效），成功后广播 */
    public boolean addPlayer(String playerId, String displayName) {
        boolean ok = engine.addPlayer(playerId, displayName);
        if (ok) commit(playerId, "join");
        return ok;
    }

    public boolean removePlayer(String playerId) {
        boolean ok = engine.removePlayer(playerId);
        if (ok) commit(playerId, "leave");
        return ok;
    }

    /** 通道回调入口 */
    public void onMessage(String fromPeerId, String message) {
        receive(fromPeerId, message);
    }

    /**
     * 处理一条入站消息（来自某个对端）。
     * 被拒绝时已经把 ERROR 发回提交者，同时把同一份错误返回给调用方（HTTP 入口要用）。
     * 非本房间或非 ACTION 的消息直接丢弃，返回空。
     */
    public Optional<ErrorPayload> receive(String fromPeerId, String message) {
        Envelope<JsonNode> env;
        A action;
        try {
            env = codec.decode(message);
            if (!roomId.equals(env.roomId()) || env.kind() != Envelope.Kind.ACTION) {
                log.warn("[{}] 主机丢弃消息：kind={} room={} from={}", roomId, env.kind(), env.roomId(), fromPeerId);
                return Optional.empty();
            }
            action = codec.readAction(env.payload(), engine.actionType());
        } catch (MalformedMessageException e) {
            log.warn("[{}] 无法解析来自 {} 的消息: {}", roomId, fromPeerId, e.getMessage());
            return reject(fromPeerId, ErrorPayload.of(ErrorPayload.BAD_MESSAGE, e.getMessage()));
        }
        if (!fromPeerId.equals(action.playerId())) {
            return reject(fromPeerId, ErrorPayload.of(ErrorPayload.NOT_YOUR_SEAT, "不能替其他玩家行动"));
        }
        if (action.hostOnly() && !hostPeerId.equals(fromPeerId)) {
            return reject(fromPeerId, ErrorPayload.of(ErrorPayload.HOST_ONLY, "只有主机可以执行该操作"));
        }
        if (!applyAndBroadcast(action)) {
            return reject(fromPeerId, ErrorPayload.of(ErrorPayload.REJECTED, "动作不合法: " + actionName(action)));
        }
        return Optional.empty();
    }

    /** 对端（重新）连上时补发一份当前快照 */
    public void resync(String peerId) {
        channel.send(peerId, codec.encode(stateEnvelope()));
    }

    /** 把当前快照广播给所有对端（新连接、重连时也会调用） */
    public void broadcastState() {
        channel.broadcast(codec.encode(stateEnvelope()));
    }

    public S snapshot() {
        return engine.serialize();
    }

    public long seq() {
        return seq;
    }

    public List<ActionLogEntry> actionLog() {
        return actionLog.entries();
    }

    public CardGameEngine<S, A> engine() {
        return engine;
    }

    public String roomId() {
        return roomId;
    }

    public String hostPeerId() {
        return hostPeerId;
    }

    // ---------------- 内部 ----------------

    private boolean applyAndBroadcast(A action) {
        boolean ok = engine.apply(action);
        if (ok) {
            commit(action.playerId(), actionName(action));
        }
        return ok;
    }

    private void commit(String playerId, String what) {
        seq++;
        actionLog.add(new ActionLogEntry(seq, playerId, what, Instant.now().toEpochMilli()));
        broadcastState();
    }

    private void onConnectionChange(String peerId, boolean connected) {
        if (connected) {
            resync(peerId);
        } else {
            log.info("[{}] 对端断开: {}", roomId, peerId);
        }
    }

    private Envelope<TableSnapshot<S>> stateEnvelope() {
        TableSnapshot<S> snap = new TableSnapshot<>(engine.serialize(), actionLog.entries());
        return Envelope.state(engine.gameType().id(), roomId, hostPeerId, snap, seq);
    }

    private Optional<ErrorPayload> reject(String peerId, ErrorPayload error) {
        log.debug("[{}] 拒绝 {}: {}", roomId, peerId, error);
        channel.send(peerId, codec.encode(Envelope.error(engine.gameType().id(), roomId, hostPeerId, error)));
        return Optional.of(error);
    }

    private String actionName(A action) {
        JsonNode type = codec.toTree(action).get("type");
        return type == null ? action.getClass().getSimpleName() : type.asText();
    }
}
