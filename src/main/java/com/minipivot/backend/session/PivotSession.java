package com.minipivot.backend.session;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.minipivot.backend.engine.PivotEngine;
import com.minipivot.backend.engine.PivotRequest;
import com.minipivot.backend.engine.PivotResult;
import com.minipivot.backend.estimate.PivotEstimation;
import com.minipivot.backend.record.Dataset;
import com.minipivot.common.ComputationException;
import com.minipivot.common.Error;

/**
 * 单个透视会话：持有当前数据集与配置，驱动 估算 -> 审批 -> 计算 的状态机。
 * <p>
 * 特点：
 * <ul>
 *     <li>计算交给注入的 {@link Executor} 执行，调用方通过返回的 future 获知完成</li>
 *     <li>每次配置变化递增 generation，过期计算完成后直接丢弃其结果</li>
 *     <li>计算异常在此处捕获并转为 ERROR 状态，不会抛出会话边界</li>
 * </ul>
 * 会话内的可变状态只在本对象锁内读写；计算本身只读取不可变快照。
 */
public class PivotSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotSession.class);

    private final String sessionId;
    private final PivotEngine engine;
    private final Executor executor;
    private final PivotResultCache cache;

    private Dataset dataset = Dataset.empty();
    /** 当前配置 */
    private PivotRequest request = PivotRequest.EMPTY;
    /** 最近一次被接受（进入计算或无需计算）的配置，取消告警时回退到它 */
    private PivotRequest accepted = PivotRequest.EMPTY;
    /** 已同意裁剪列的配置 */
    private final Set<PivotRequest> approved = new HashSet<>();

    private ComputationState state = ComputationState.IDLE;
    private PivotEstimation estimation;
    private PivotResult result;
    private ComputationException failure;
    private long generation = 0;
    private CompletableFuture<ComputationState> inFlight;

    public PivotSession(String sessionId, PivotEngine engine, Executor executor, PivotResultCache cache) {
        this.sessionId = sessionId;
        this.engine = Objects.requireNonNull(engine, "engine");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    /**
     * 替换数据集，清空配置、结果与审批记录。
     */
    public synchronized void load(Dataset newDataset) {
        Objects.requireNonNull(newDataset, "dataset");
        cache.invalidate(dataset);
        generation++;
        dataset = newDataset;
        request = PivotRequest.EMPTY;
        accepted = PivotRequest.EMPTY;
        approved.clear();
        reset(ComputationState.IDLE);
        LOGGER.info("[session={}] Load {} with fields {}", sessionId, newDataset, newDataset.fields());
    }

    /**
     * 提交新配置。相同数据集上的相同配置不会重复触发计算。
     *
     * @return 本次提交稳定后的状态；无需计算或等待审批时立即完成
     */
    public synchronized CompletableFuture<ComputationState> submit(PivotRequest newRequest) {
        Objects.requireNonNull(newRequest, "request");
        if(newRequest.equals(request) && state != ComputationState.ERROR) {
            if(state == ComputationState.COMPUTING && inFlight != null) {
                return inFlight;
            }
            return CompletableFuture.completedFuture(state);
        }
        return doSubmit(newRequest);
    }

    /**
     * 处理列数告警。
     *
     * @throws Exception 当前不在等待审批状态时抛出 {@link Error#NoPendingApprovalException}
     */
    public synchronized CompletableFuture<ComputationState> decide(Decision decision) throws Exception {
        if(state != ComputationState.AWAITING_APPROVAL) {
            throw Error.NoPendingApprovalException;
        }
        if(decision == Decision.PROCEED_WITH_LIMITING) {
            LOGGER.info("[session={}] Proceed with column limiting: {}", sessionId, request);
            approved.add(request);
            accepted = request;
            return startComputing(request, true);
        }

        PivotRequest revert = accepted;
        LOGGER.info("[session={}] Cancel {}, revert to {}", sessionId, request, revert);
        generation++;
        transition(ComputationState.IDLE);
        if(revert.isEmpty()) {
            request = revert;
            reset(ComputationState.IDLE);
            return CompletableFuture.completedFuture(state);
        }
        return doSubmit(revert);
    }

    private CompletableFuture<ComputationState> doSubmit(PivotRequest newRequest) {
        generation++;
        request = newRequest;
        reset(ComputationState.IDLE);

        if(newRequest.isEmpty()) {
            // 三个区域都为空，展示原始数据
            accepted = newRequest;
            return CompletableFuture.completedFuture(state);
        }

        transition(ComputationState.ESTIMATING);
        try {
            estimation = engine.estimate(dataset, newRequest);
        } catch (Exception e) {
            fail(e);
            return CompletableFuture.completedFuture(state);
        }

        boolean approvedBefore = approved.contains(newRequest);
        if(estimation.isShouldWarn() && !approvedBefore) {
            transition(ComputationState.AWAITING_APPROVAL);
            return CompletableFuture.completedFuture(state);
        }
        accepted = newRequest;
        return startComputing(newRequest, estimation.isShouldWarn());
    }

    private CompletableFuture<ComputationState> startComputing(PivotRequest req, boolean limitColumns) {
        transition(ComputationState.COMPUTING);
        final long gen = generation;
        final Dataset snapshot = dataset;

        PivotResult cached = cache.get(snapshot, req, limitColumns);
        if(cached != null) {
            LOGGER.debug("[session={}] Cache hit: {}", sessionId, req);
            result = cached;
            transition(ComputationState.READY);
            return CompletableFuture.completedFuture(state);
        }

        CompletableFuture<ComputationState> future = new CompletableFuture<>();
        inFlight = future;
        try {
            executor.execute(() -> run(gen, snapshot, req, limitColumns, future));
        } catch (RejectedExecutionException e) {
            fail(e);
            future.complete(state);
        }
        return future;
    }

    private void run(long gen, Dataset snapshot, PivotRequest req, boolean limitColumns,
                     CompletableFuture<ComputationState> future) {
        PivotResult computed = null;
        Throwable error = null;
        try {
            computed = engine.compute(snapshot, req, limitColumns);
        } catch (Throwable e) {
            // 包括 OutOfMemoryError 在内的任何失败都进入 ERROR 并完成 future
            error = e;
        }

        ComputationState settled;
        synchronized (this) {
            if(gen != generation) {
                LOGGER.debug("[session={}] Discard stale result of {}", sessionId, req);
            } else if(error != null) {
                fail(error);
            } else {
                cache.put(snapshot, req, limitColumns, computed);
                result = computed;
                transition(ComputationState.READY);
            }
            if(inFlight == future) {
                inFlight = null;
            }
            settled = state;
        }
        future.complete(settled);
    }

    private void fail(Throwable e) {
        String message = e.getMessage() == null ? "Pivot computation failed" : e.getMessage();
        LOGGER.error("[session={}] Pivot computation failed: {}", sessionId, request, e);
        failure = new ComputationException(message, e);
        result = null;
        transition(ComputationState.ERROR);
    }

    private void reset(ComputationState to) {
        estimation = null;
        result = null;
        failure = null;
        inFlight = null;
        state = to;
    }

    private void transition(ComputationState to) {
        LOGGER.debug("[session={}] {} -> {}", sessionId, state, to);
        state = to;
    }

    public synchronized SessionStatus status() {
        return new SessionStatus(state, request, estimation, result,
                failure == null ? null : failure.getMessage());
    }

    public synchronized ComputationState state() {
        return state;
    }

    public synchronized PivotRequest request() {
        return request;
    }

    public synchronized PivotResult result() {
        return result;
    }

    public synchronized PivotEstimation estimation() {
        return estimation;
    }

    public synchronized ComputationException failure() {
        return failure;
    }

    public synchronized Dataset dataset() {
        return dataset;
    }

    /** 关闭会话：丢弃在途计算并清除缓存条目 */
    public synchronized void close() {
        generation++;
        cache.invalidate(dataset);
        reset(ComputationState.IDLE);
    }

    public String getSessionId() {
        return sessionId;
    }
}
