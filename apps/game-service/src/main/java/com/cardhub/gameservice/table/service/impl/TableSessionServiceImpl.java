package com.cardhub.gameservice.table.service.impl;

import com.cardhub.engine.core.CardGameEngine;
import com.cardhub.engine.core.Command;
import com.cardhub.engine.core.GameType;
import com.cardhub.engine.core.TableState;
import com.cardhub.engine.replication.Envelope;
import com.cardhub.engine.replication.ErrorPayload;
import com.cardhub.engine.replication.HostReplicator;
import com.cardhub.engine.replication.MalformedMessageException;
import com.cardhub.engine.replication.SnapshotCodec;
import com.cardhub.gameservice.config.CardHubProperties;
import com.cardhub.gameservice.table.domain.constants.GameMessages;
import com.cardhub.gameservice.table.domain.model.TableNotFoundException;
import com.cardhub.gameservice.table.domain.model.TableSession;
import com.cardhub.gameservice.table.domain.model.TableView;
import com.cardhub.gameservice.table.engine.TableEngineFactory;
import com.cardhub.gameservice.table.infrastructure.ws.StompPeerChannel;
import com.cardhub.gameservice.table.service.TableSessionService;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 牌桌会话服务：进程内保存所有牌桌，本进程就是每张牌桌的主机。
 * 所有引擎调用都排到牌桌自己的单线程执行器上。
 */
@Slf4j
@Service
public class TableSessionServiceImpl implements TableSessionService {

    private final TableEngineFactory engineFactory;
    private final SimpMessagingTemplate messaging;
    private final CardHubProperties props;
    private final SnapshotCodec codec = new SnapshotCodec();
    private final Map<String, TableSession> tables = new ConcurrentHashMap<>();

    public TableSessionServiceImpl(TableEngineFactory engineFactory,
                                   SimpMessagingTemplate messaging,
                                   CardHubProperties props) {
        this.engineFactory = engineFactory;
        this.messaging = messaging;
        this.props = props;
    }

    @Override
    public String createTable(GameType game, String hostId, String hostName) {
        Validate.notNull(game, "game 不能为空");
        Validate.notBlank(hostId, "hostId 不能为空");
        String roomId = UUID.randomUUID().toString().replace("-", "").substring(0, 10);
        StompPeerChannel channel = new StompPeerChannel(messaging, roomId);
        HostReplicator<?, ?> replicator = host(engineFactory.create(game), channel, roomId, hostId);
        TableSession session = new TableSession(roomId, game, hostId, replicator, channel);
        register(session);
        try {
            session.call(() -> replicator.addPlayer(hostId, StringUtils.defaultIfBlank(hostName, hostId)), timeout());
        } catch (RuntimeException e) {
            tables.remove(roomId);
            session.close();
            log.warn("[{}] 主机入座失败，撤销开桌: {}", roomId, e.getMessage());
            throw e;
        }
        log.info("[{}] 开桌 game={} host={}", roomId, game.id(), hostId);
        return roomId;
    }

    @Override
    public TableView view(String roomId) {
        TableSession session = require(roomId);
        return session.call(() -> toView(session), timeout());
    }

    @Override
    public TableView join(String roomId, String playerId, String displayName) {
        Validate.notBlank(playerId, "playerId 不能为空");
        TableSession session = require(roomId);
        return session.call(() -> {
            if (!session.getReplicator().addPlayer(playerId, displayName)) {
                throw new IllegalStateException(GameMessages.JOIN_REJECTED);
            }
            log.info("[{}] 入座 {}", roomId, playerId);
            return toView(session);
        }, timeout());
    }

    @Override
    public TableView leave(String roomId, String playerId) {
        TableSession session = require(roomId);
        return session.call(() -> {
            if (!session.getReplicator().removePlayer(playerId)) {
                throw new IllegalStateException(GameMessages.LEAVE_REJECTED);
            }
            log.info("[{}] 离座 {}", roomId, playerId);
            return toView(session);
        }, timeout());
    }

    @Override
    public TableView submit(String roomId, String peerId, JsonNode action) {
        Validate.notBlank(peerId, GameMessages.PEER_ID_REQUIRED);
        Validate.notNull(action, "action 不能为空");
        TableSession session = require(roomId);
        String message = codec.encode(Envelope.action(session.getGameType().id(), roomId, peerId, action));
        return session.call(() -> {
            Optional<ErrorPayload> error = session.getReplicator().receive(peerId, message);
            if (error.isPresent()) {
                ErrorPayload e = error.get();
                if (ErrorPayload.BAD_MESSAGE.equals(e.code())) {
                    throw new IllegalArgumentException(e.message());
                }
                throw new IllegalStateException(e.code() + ": " + e.message());
            }
            return toView(session);
        }, timeout());
    }

    @Override
    public void deliver(String principalPeerId, String envelopeJson) {
        Envelope<JsonNode> env;
        try {
            env = codec.decode(envelopeJson);
        } catch (MalformedMessageException e) {
            log.warn("丢弃无法解析的入站消息（来自 {}）: {}", principalPeerId, e.getMessage());
            return;
        }
        String peerId = StringUtils.defaultIfBlank(principalPeerId, env.senderId());
        if (StringUtils.isBlank(peerId)) {
            log.warn("[{}] 入站消息缺少发送者，丢弃", env.roomId());
            return;
        }
        TableSession session = tables.get(env.roomId());
        if (session == null) {
            log.warn("丢弃发往未知牌桌 {} 的消息（来自 {}）", env.roomId(), peerId);
            return;
        }
        session.execute(() -> session.getChannel().deliver(peerId, envelopeJson));
    }

    @Override
    public void resync(String roomId, String peerId) {
        if (StringUtils.isBlank(peerId)) {
            throw new IllegalArgumentException(GameMessages.PEER_ID_REQUIRED);
        }
        TableSession session = require(roomId);
        session.execute(() -> markOnline(session, peerId));
    }

    @Override
    public void peerSubscribed(String roomId, String peerId) {
        if (StringUtils.isBlank(peerId)) {
            return;
        }
        TableSession session = tables.get(roomId);
        if (session == null) {
            log.debug("忽略对未知牌桌 {} 的订阅（来自 {}）", roomId, peerId);
            return;
        }
        session.execute(() -> markOnline(session, peerId));
    }

    @Override
    public void peerDisconnected(String peerId) {
        if (StringUtils.isBlank(peerId)) {
            return;
        }
        tables.values().forEach(session -> session.execute(() -> {
            if (session.getOnlinePeers().remove(peerId)) {
                session.getChannel().disconnected(peerId);
            }
        }));
    }

    @Override
    public void closeTable(String roomId) {
        TableSession session = tables.remove(roomId);
        if (session == null) {
            throw new TableNotFoundException(roomId);
        }
        session.close();
        log.info("[{}] 关桌", roomId);
    }

    @Override
    public int tableCount() {
        return tables.size();
    }

    @PreDestroy
    public void shutdown() {
        tables.values().forEach(TableSession::close);
        tables.clear();
    }

    // ---------------- 内部 ----------------

    private TableSession require(String roomId) {
        TableSession session = tables.get(roomId);
        if (session == null) {
            throw new TableNotFoundException(roomId);
        }
        return session;
    }

    /** 上限检查与登记在同一把锁内 */
    private synchronized void register(TableSession session) {
        int max = props.getTable().getMaxTables();
        if (tables.size() >= max) {
            session.close();
            throw new IllegalStateException(GameMessages.formatTableLimit(max));
        }
        tables.put(session.getRoomId(), session);
    }

    /** 只在牌桌线程上调用：登记在线并补发快照 */
    private static void markOnline(TableSession session, String peerId) {
        session.getOnlinePeers().add(peerId);
        session.getChannel().connected(peerId);
    }

    private long timeout() {
        return props.getTable().getCallTimeoutMillis();
    }

    /** 只在牌桌线程上调用 */
    private static TableView toView(TableSession session) {
        HostReplicator<?, ?> r = session.getReplicator();
        return new TableView(session.getRoomId(), session.getGameType(), session.getHostId(),
                r.seq(), r.snapshot(), r.actionLog(), List.copyOf(session.getOnlinePeers()));
    }

    private <S extends TableState<?>, A extends Command> HostReplicator<S, A> host(
            CardGameEngine<S, A> engine, StompPeerChannel channel, String roomId, String hostId) {
        return new HostReplicator<>(engine, channel, codec, roomId, hostId);
    }
}
