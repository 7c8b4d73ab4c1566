package com.cardhub.engine.replication;

import com.cardhub.engine.core.CardGameEngine;
import com.cardhub.engine.core.Command;
import com.cardhub.engine.core.TableState;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 非主机端复制：本地引擎只是镜像。
 * - 动作一律发给主机，本地不 apply；
 * - 收到本房间的 STATE 就整体替换本地状态（不比较 seq，不做增量）；
 * - 离开房间后（detach）再来的快照全部丢弃。
 */
@Slf4j
public class MirrorReplicator<S extends TableState<?>, A extends Command> {

    private final CardGameEngine<S, A> mirror;
    private final PeerChannel channel;
    private final SnapshotCodec codec;
    private final String roomId;
    private final String localPeerId;
    private final String hostPeerId;
    private final ActionLog actionLog = new ActionLog();
    private volatile boolean attached = true;
    private long lastSeq = -1;
    private Consumer<S> stateListener = s -> { };
    private Consumer<ErrorPayload> errorListener = e -> { };

    public MirrorReplicator(CardGameEngine<S, A> mirror, PeerChannel channel, SnapshotCodec codec,
                            String roomId, String localPeerId, String hostPeerId) {
        this.mirror = Objects.requireNonNull(mirror, "mirror");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.localPeerId = Objects.requireNonNull(localPeerId, "localPeerId");
        this.hostPeerId = Objects.requireNonNull(hostPeerId, "hostPeerId");
        channel.onReceive(this::onMessage);
    }

    /** 把意图发给主机 */
    public void submit(A action) {
        if (!attached) {
            throw new IllegalStateException("已离开房间 " + roomId);
        }
        JsonNode payload = codec.toTree(action);
        channel.send(hostPeerId, codec.encode(Envelope.action(mirror.gameType().id(), roomId, localPeerId, payload)));
    }

    public void onMessage(String fromPeerId, String message) {
        if (!attached) {
            log.debug("[{}] 已离开房间，丢弃来自 {} 的消息", roomId, fromPeerId);
            return;
        }
        Envelope<JsonNode> env;
        try {
            env = codec.decode(message);
        } catch (MalformedMessageException e) {
            log.warn("[{}] 丢弃无法解析的消息: {}", roomId, e.getMessage());
            return;
        }
        if (!roomId.equals(env.roomId())) {
            log.warn("[{}] 丢弃其他房间的消息: {}", roomId, env);
            return;
        }
        if (!hostPeerId.equals(fromPeerId)) {
            log.warn("[{}] 丢弃非主机 {} 发来的消息", roomId, fromPeerId);
            return;
        }
        try {
            switch (env.kind()) {
                case STATE -> adopt(env);
                case ERROR -> errorListener.accept(codec.readError(env.payload()));
                case ACTION -> log.debug("[{}] 镜像忽略 ACTION 消息", roomId);
            }
        } catch (MalformedMessageException e) {
            log.warn("[{}] 丢弃载荷损坏的 {} 消息: {}", roomId, env.kind(), e.getMessage());
        }
    }

    /** 离开会话：之后的快照不再采纳 */
    public void detach() {
        attached = false;
    }

    public S state() {
        return mirror.getState();
    }

    public long lastSeq() {
        return lastSeq;
    }

    public List<ActionLogEntry> actionLog() {
        return actionLog.entries();
    }

    public void setStateListener(Consumer<S> listener) {
        this.stateListener = Objects.requireNonNull(listener);
    }

    public void setErrorListener(Consumer<ErrorPayload> listener) {
        this.errorListener = Objects.requireNonNull(listener);
    }

    private void adopt(Envelope<JsonNode> env) {
        TableSnapshot<S> snap = codec.readSnapshot(env.payload(), mirror.stateType());
        mirror.setState(snap.state());
        actionLog.replaceWith(snap.actionLog());
        lastSeq = env.seq();
        stateListener.accept(mirror.getState());
    }
}
