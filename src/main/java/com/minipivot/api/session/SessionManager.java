package com.minipivot.api.session;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.minipivot.api.config.PivotConfig;
import com.minipivot.api.exception.SessionNotFoundException;
import com.minipivot.backend.engine.PivotEngine;
import com.minipivot.backend.record.Dataset;
import com.minipivot.backend.session.PivotResultCache;
import com.minipivot.backend.session.PivotSession;

/**
 * 透视会话注册表，负责创建、查找及关闭多个 {@link PivotSession}。
 * 所有会话共享同一个计算线程池与结果缓存。
 */
@Component
public class SessionManager implements DisposableBean {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

    private final PivotEngine engine;
    private final PivotResultCache cache;
    private final ExecutorService workers;
    private final Map<String, ManagedSession> sessions = new ConcurrentHashMap<>();
    private final long sessionTtlMillis;

    public SessionManager(PivotConfig config) {
        this.sessionTtlMillis = config.getSessionTtlMillis();
        this.engine = new PivotEngine(config.toEngineOptions());
        this.cache = new PivotResultCache(config.getCacheSize());
        this.workers = Executors.newFixedThreadPool(Math.max(1, config.getWorkerThreads()),
                new ThreadFactoryBuilder().setNameFormat("pivot-worker-%d").setDaemon(true).build());
    }

    /**
     * 创建一个新的 session 并载入数据集，返回 sessionId。
     */
    public String createSession(Dataset dataset) {
        String sessionId = UUID.randomUUID().toString();
        PivotSession session = new PivotSession(sessionId, engine, workers, cache);
        session.load(dataset);
        sessions.put(sessionId, new ManagedSession(session));
        LOGGER.info("创建 session {}，共 {} 条记录", sessionId, dataset.size());
        return sessionId;
    }

    /**
     * 根据 sessionId 获取会话，不存在时抛出异常。
     */
    public PivotSession getRequiredSession(String sessionId) {
        ManagedSession managed = sessions.get(sessionId);
        if (managed == null) {
            throw new SessionNotFoundException(sessionId);
        }
        managed.touch();
        return managed.session;
    }

    /**
     * 关闭并移除指定 session。
     *
     * @return true 表示存在且已关闭，false 表示 sessionId 不存在
     */
    public boolean closeSession(String sessionId) {
        ManagedSession managed = sessions.remove(sessionId);
        if (managed == null) {
            return false;
        }
        managed.session.close();
        return true;
    }

    /**
     * 关闭超过 TTL 未访问的 session。
     */
    @Scheduled(fixedDelayString = "${minipivot.engine.evict-interval-millis:60000}")
    public void evictIdleSessions() {
        long now = System.currentTimeMillis();
        sessions.forEach((id, managed) -> {
            if (now - managed.lastAccessTs.get() > sessionTtlMillis && sessions.remove(id, managed)) {
                managed.session.close();
                LOGGER.info("session {} 超时关闭", id);
            }
        });
    }

    public int size() {
        return sessions.size();
    }

    @Override
    public void destroy() {
        sessions.values().forEach(m -> m.session.close());
        sessions.clear();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warn("计算线程池未能在 5 秒内退出");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class ManagedSession {
        private final PivotSession session;
        private final AtomicLong lastAccessTs = new AtomicLong(System.currentTimeMillis());

        private ManagedSession(PivotSession session) {
            this.session = session;
        }

        private void touch() {
            lastAccessTs.set(System.currentTimeMillis());
        }
    }
}
