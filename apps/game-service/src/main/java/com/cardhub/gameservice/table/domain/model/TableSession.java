package com.cardhub.gameservice.table.domain.model;

import com.cardhub.engine.core.GameType;
import com.cardhub.engine.replication.HostReplicator;
import com.cardhub.gameservice.table.domain.constants.GameMessages;
import com.cardhub.gameservice.table.infrastructure.ws.StompPeerChannel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 一张牌桌的运行时：主机复制器 + STOMP 通道 + 单线程执行器。
 * 复制器与引擎只在执行器线程上被访问，执行器即主机的入站队列。
 */
@Slf4j
@Getter
public class TableSession {

    private final String roomId;
    private final GameType gameType;
    private final String hostId;
    private final long createdAt;
    private final HostReplicator<?, ?> replicator;
    private final StompPeerChannel channel;
    private final ExecutorService executor;
    /** 当前订阅着本桌私有队列的对端，只在牌桌线程上读写 */
    private final Set<String> onlinePeers = new LinkedHashSet<>();

    public TableSession(String roomId, GameType gameType, String hostId,
                        HostReplicator<?, ?> replicator, StompPeerChannel channel) {
        this.roomId = roomId;
        this.gameType = gameType;
        this.hostId = hostId;
        this.createdAt = System.currentTimeMillis();
        this.replicator = replicator;
        this.channel = channel;
        this.executor = Executors.newSingleThreadExecutor(new BasicThreadFactory.Builder()
                .namingPattern("table-" + roomId + "-%d")
                .daemon(true)
                .build());
    }

    /** 异步排队执行（WS 入站），异常只记录 */
    public void execute(Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("[{}] 牌桌任务失败", roomId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[{}] 牌桌已关闭，丢弃任务", roomId);
        }
    }

    /** 排队执行并等待结果（HTTP 入站），业务异常原样抛出 */
    public <T> T call(Callable<T> task, long timeoutMillis) {
        try {
            return executor.submit(task).get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(GameMessages.TABLE_BUSY, e);
        } catch (TimeoutException | RejectedExecutionException e) {
            throw new IllegalStateException(GameMessages.TABLE_BUSY, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(e.getCause());
        }
    }

    public void close() {
        executor.shutdown();
    }
}
